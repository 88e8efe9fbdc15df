package win.ixuni.buckets.core.model;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;

/**
 * Object download: response headers plus the lazily consumed payload
 * <p>
 * Headers are available before the body is read, so a caller can inspect {@code content-md5} and
 * {@code content-length} first. The content stream can be subscribed to once; cancelling it aborts
 * the underlying request.
 */
@Value
@Builder
public class ObjectDownload {

    int status;

    ResponseHeaders headers;

    /**
     * Object content stream (reactive)
     */
    Flux<ByteBuffer> content;

    /**
     * Abort the payload without reading it
     */
    public Mono<Void> discard() {
        return content.take(0).then();
    }
}
