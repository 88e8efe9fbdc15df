package win.ixuni.buckets.core.exception;

import lombok.Getter;

/**
 * Buckets client base exception
 */
@Getter
public class BucketsException extends RuntimeException {

    private final ErrorKind kind;
    private final int httpStatus;

    public BucketsException(ErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public BucketsException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public BucketsException(ErrorKind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }
}
