package win.ixuni.buckets.core.transport;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.buckets.core.model.ResponseHeaders;

import java.nio.ByteBuffer;

/**
 * Response produced by the transport
 * <p>
 * The body must be consumed or cancelled exactly once so the connection is returned to the pool.
 */
@Value
@Builder
public class TransportResponse {

    int status;

    ResponseHeaders headers;

    /**
     * Response body stream; empty for HEAD and bodiless responses
     */
    @Builder.Default
    Flux<ByteBuffer> body = Flux.empty();

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
