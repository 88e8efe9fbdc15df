package win.ixuni.buckets.core.exception;

/**
 * Invalid local input (empty names, unsafe header values, out-of-range options)
 */
public class InvalidArgumentException extends BucketsException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
