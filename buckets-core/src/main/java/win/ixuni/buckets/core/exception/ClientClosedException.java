package win.ixuni.buckets.core.exception;

/**
 * Operation attempted on a closed client
 */
public class ClientClosedException extends BucketsException {

    public ClientClosedException(String clientName) {
        super(ErrorKind.CLIENT_CLOSED, "Buckets client '" + clientName + "' is closed");
    }
}
