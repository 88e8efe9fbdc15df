package win.ixuni.buckets.core.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Request handed to the transport
 * <p>
 * The path is already percent-encoded; query values are raw and encoded by the transport.
 */
@Value
@Builder
public class TransportRequest {

    HttpMethod method;

    /**
     * Encoded resource path, e.g. {@code /acct/buckets/b1/objects/o1}
     */
    String path;

    /**
     * Query parameters in insertion order
     */
    @Singular("queryParam")
    Map<String, String> query;

    @Singular
    Map<String, String> headers;

    /**
     * Request body, or null when the request carries none
     */
    Flux<ByteBuffer> body;

    public boolean hasBody() {
        return body != null;
    }

    public String describe() {
        return method + " " + path;
    }
}
