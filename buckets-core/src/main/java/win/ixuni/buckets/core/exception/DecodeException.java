package win.ixuni.buckets.core.exception;

import lombok.Getter;

/**
 * Malformed line in a listing stream
 */
@Getter
public class DecodeException extends BucketsException {

    /**
     * 1-based line number within the response body, or -1 when unknown
     */
    private final long lineNumber;

    public DecodeException(String message, long lineNumber) {
        this(message, lineNumber, null);
    }

    public DecodeException(String message, long lineNumber, Throwable cause) {
        super(ErrorKind.DECODE, lineNumber > 0 ? message + " (line " + lineNumber + ")" : message, cause);
        this.lineNumber = lineNumber;
    }
}
