package win.ixuni.buckets.core.exception;

import win.ixuni.buckets.core.model.ResponseHeaders;

/**
 * Bucket or object does not exist (HTTP 404)
 */
public class NotFoundException extends HttpStatusException {

    public NotFoundException(ResponseHeaders headers, String body, String restCode, String restMessage) {
        super(ErrorKind.NOT_FOUND, 404, headers, body, restCode, restMessage);
    }
}
