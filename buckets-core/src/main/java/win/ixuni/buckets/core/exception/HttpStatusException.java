package win.ixuni.buckets.core.exception;

import lombok.Getter;
import win.ixuni.buckets.core.model.ResponseHeaders;

/**
 * Non-success HTTP status returned by the service
 * <p>
 * Carries the raw response body. When the body is a JSON error document
 * ({@code {"code": "...", "message": "..."}}) the service code and message are extracted as well.
 */
@Getter
public class HttpStatusException extends BucketsException {

    private final ResponseHeaders headers;
    private final String body;
    private final String restCode;
    private final String restMessage;

    public HttpStatusException(int httpStatus, ResponseHeaders headers, String body,
                               String restCode, String restMessage) {
        this(ErrorKind.HTTP_STATUS, httpStatus, headers, body, restCode, restMessage);
    }

    protected HttpStatusException(ErrorKind kind, int httpStatus, ResponseHeaders headers, String body,
                                  String restCode, String restMessage) {
        super(kind, describe(httpStatus, restCode, restMessage), httpStatus, null);
        this.headers = headers;
        this.body = body;
        this.restCode = restCode;
        this.restMessage = restMessage;
    }

    private static String describe(int httpStatus, String restCode, String restMessage) {
        StringBuilder sb = new StringBuilder("HTTP ").append(httpStatus);
        if (restCode != null) {
            sb.append(" ").append(restCode);
        }
        if (restMessage != null) {
            sb.append(": ").append(restMessage);
        }
        return sb.toString();
    }
}
