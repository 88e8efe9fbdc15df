package win.ixuni.buckets.core.exception;

/**
 * Network level failure: connect, read, write or timeout
 */
public class TransportException extends BucketsException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
