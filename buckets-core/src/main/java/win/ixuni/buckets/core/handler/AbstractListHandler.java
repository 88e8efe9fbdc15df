package win.ixuni.buckets.core.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import win.ixuni.buckets.core.codec.JsonStreamDecoder;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.model.ResponseHeaders;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.StreamOperation;
import win.ixuni.buckets.core.operation.StreamOperationHandler;
import win.ixuni.buckets.core.transport.TransportRequest;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 列表 Handler 抽象基类
 * <p>
 * Decodes one page of newline-delimited JSON records and, while the server keeps returning a
 * {@code next-marker} header, follows it with another request once the current page is drained.
 * Pages are fetched strictly one after another and only on demand.
 *
 * @param <O> 操作类型
 * @param <T> record type
 */
@Slf4j
public abstract class AbstractListHandler<O extends StreamOperation<T>, T> implements StreamOperationHandler<O, T> {

    @Override
    public final Flux<T> handle(O operation, ClientContext context) {
        return Flux.defer(() -> {
            ListOptions options = optionsOf(operation);
            return page(operation, context, options);
        });
    }

    private Flux<T> page(O operation, ClientContext context, ListOptions options) {
        TransportRequest request = buildRequest(operation, context, options);
        JsonStreamDecoder<T> decoder = new JsonStreamDecoder<>(getRecordType(),
                context.getConfig().getMaxLineLength(), this::checkRecord);

        return context.getTransport().exchange(request).flatMapMany(response -> {
            if (!response.isSuccess()) {
                return ResponseSupport.<T>statusError(response).flux();
            }
            String nextMarker = response.getHeaders().getFirst(ResponseHeaders.NEXT_MARKER);
            Flux<T> records = decoder.decode(response.getBody());
            if (!options.isPaginate() || nextMarker == null || nextMarker.isEmpty()
                    || nextMarker.equals(options.getMarker())) {
                return records;
            }

            AtomicLong count = new AtomicLong();
            return records
                    .doOnNext(record -> count.incrementAndGet())
                    .concatWith(Flux.defer(() -> {
                        // an empty page with a marker would loop forever
                        if (count.get() == 0) {
                            log.debug("Empty page carried next-marker {}, stopping", nextMarker);
                            return Flux.empty();
                        }
                        log.trace("Following next-marker {}", nextMarker);
                        return page(operation, context, options.withMarker(nextMarker));
                    }));
        });
    }

    /**
     * Listing options carried by the operation, never null
     */
    protected abstract ListOptions optionsOf(O operation);

    protected abstract TransportRequest buildRequest(O operation, ClientContext context, ListOptions options);

    protected abstract Class<T> getRecordType();

    /**
     * Validate one decoded record
     *
     * @return what is wrong with the record, or null when it is acceptable
     */
    protected String checkRecord(T record) {
        return null;
    }
}
