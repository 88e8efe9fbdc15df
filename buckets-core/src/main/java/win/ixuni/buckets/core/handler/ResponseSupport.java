package win.ixuni.buckets.core.handler;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.exception.HttpStatusException;
import win.ixuni.buckets.core.exception.NotFoundException;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.model.ResponseHeaders;
import win.ixuni.buckets.core.transport.TransportResponse;
import win.ixuni.buckets.core.util.JsonUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Shared response handling: success draining and status error construction
 */
public final class ResponseSupport {

    /**
     * Error bodies beyond this size are truncated in the exception
     */
    static final int MAX_ERROR_BODY = 64 * 1024;

    private ResponseSupport() {
    }

    /**
     * Drain the body of a 2xx response and return its status and headers; anything else fails
     */
    public static Mono<ObjectResponse> expectSuccess(TransportResponse response) {
        if (!response.isSuccess()) {
            return statusError(response);
        }
        return response.getBody()
                .then(Mono.fromCallable(() -> new ObjectResponse(response.getStatus(), response.getHeaders())));
    }

    /**
     * Read the error body and fail with {@link HttpStatusException}, or {@link NotFoundException} for 404
     */
    public static <T> Mono<T> statusError(TransportResponse response) {
        return response.getBody()
                .reduce(new ByteArrayOutputStream(), (baos, buffer) -> {
                    int room = MAX_ERROR_BODY - baos.size();
                    if (room > 0) {
                        byte[] bytes = new byte[Math.min(room, buffer.remaining())];
                        buffer.duplicate().get(bytes);
                        baos.write(bytes, 0, bytes.length);
                    }
                    return baos;
                })
                .map(baos -> baos.toString(StandardCharsets.UTF_8))
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(toException(response.getStatus(), response.getHeaders(), body)));
    }

    static HttpStatusException toException(int status, ResponseHeaders headers, String body) {
        String restCode = null;
        String restMessage = null;
        JsonNode node = JsonUtils.readTreeOrNull(body);
        if (node != null) {
            restCode = textOrNull(node, "code");
            restMessage = textOrNull(node, "message");
        }
        if (status == 404) {
            return new NotFoundException(headers, body, restCode, restMessage);
        }
        return new HttpStatusException(status, headers, body, restCode, restMessage);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() ? value.asText() : null;
    }
}
