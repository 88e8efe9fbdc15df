package win.ixuni.buckets.core.exception;

/**
 * The upload source failed or produced a byte count different from the declared length
 */
public class PayloadStreamException extends BucketsException {

    public PayloadStreamException(String message) {
        super(ErrorKind.PAYLOAD_STREAM, message);
    }

    public PayloadStreamException(String message, Throwable cause) {
        super(ErrorKind.PAYLOAD_STREAM, message, cause);
    }
}
