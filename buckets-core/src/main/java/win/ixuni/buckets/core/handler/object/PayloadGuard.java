package win.ixuni.buckets.core.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.exception.InvalidArgumentException;
import win.ixuni.buckets.core.exception.PayloadStreamException;
import win.ixuni.buckets.core.exception.TransportErrors;
import win.ixuni.buckets.core.exception.TransportException;
import win.ixuni.buckets.core.model.ObjectRequestOptions;
import win.ixuni.buckets.core.model.ResponseHeaders;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Byte accounting for object payloads in both directions
 */
final class PayloadGuard {

    private PayloadGuard() {
    }

    /**
     * Upload side: source errors become {@link PayloadStreamException}, and a payload that does
     * not add up to the declared length fails the same way
     *
     * @param declaredLength declared length, or -1 when the upload is chunked
     */
    static Flux<ByteBuffer> guardUpload(Flux<ByteBuffer> payload, long declaredLength) {
        return Flux.defer(() -> {
            AtomicLong sent = new AtomicLong();
            return payload
                    .onErrorMap(e -> !(e instanceof PayloadStreamException),
                            e -> new PayloadStreamException("Upload source failed: " + e.getMessage(), e))
                    .doOnNext(buffer -> {
                        long total = sent.addAndGet(buffer.remaining());
                        if (declaredLength >= 0 && total > declaredLength) {
                            throw new PayloadStreamException("Upload source produced more than the declared "
                                    + declaredLength + " bytes");
                        }
                    })
                    .concatWith(Mono.defer(() -> declaredLength >= 0 && sent.get() != declaredLength
                            ? Mono.error(new PayloadStreamException("Upload source ended after " + sent.get()
                            + " of the declared " + declaredLength + " bytes"))
                            : Mono.empty()));
        });
    }

    /**
     * Download side: a body shorter than the announced {@code content-length} is a transport failure
     */
    static Flux<ByteBuffer> guardDownload(Flux<ByteBuffer> body, long announcedLength, String what) {
        return Flux.defer(() -> {
            AtomicLong received = new AtomicLong();
            return body
                    .onErrorMap(TransportErrors::isNetworkFailure,
                            e -> TransportErrors.toTransportException(what, e))
                    .doOnNext(buffer -> received.addAndGet(buffer.remaining()))
                    .concatWith(Mono.defer(() -> announcedLength >= 0 && received.get() < announcedLength
                            ? Mono.error(new TransportException(what + ": response body truncated after "
                            + received.get() + " of " + announcedLength + " bytes"))
                            : Mono.empty()));
        });
    }

    /**
     * Declared upload length: an explicit {@code content-length} header override wins over the option
     */
    static long declaredLength(ObjectRequestOptions options) {
        if (options == null) {
            return -1;
        }
        for (Map.Entry<String, String> header : options.getHeaders().entrySet()) {
            if (ResponseHeaders.CONTENT_LENGTH.equalsIgnoreCase(header.getKey())) {
                if (header.getValue() == null) {
                    throw new InvalidArgumentException("content-length header must have a value");
                }
                try {
                    return Long.parseLong(header.getValue().trim());
                } catch (NumberFormatException e) {
                    throw new InvalidArgumentException("Invalid content-length header: " + header.getValue());
                }
            }
        }
        return options.getContentLength() != null ? options.getContentLength() : -1;
    }
}
