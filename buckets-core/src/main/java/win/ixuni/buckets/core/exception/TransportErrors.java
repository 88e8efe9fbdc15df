package win.ixuni.buckets.core.exception;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies raw failures coming out of the network layer
 */
public final class TransportErrors {

    private TransportErrors() {
    }

    /**
     * True for I/O and timeout failures (anywhere in the cause chain) not already mapped
     */
    public static boolean isNetworkFailure(Throwable error) {
        if (error instanceof BucketsException) {
            return false;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof UncheckedIOException || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    /**
     * First buckets exception in the cause chain, or null
     * <p>
     * HTTP clients wrap errors raised by a request body publisher; this recovers the original.
     */
    public static BucketsException findBucketsException(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof BucketsException bucketsException) {
                return bucketsException;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    /**
     * Map a raw failure to the buckets taxonomy: a wrapped buckets exception is unwrapped,
     * anything else becomes a {@link TransportException}
     */
    public static BucketsException translate(String what, Throwable error) {
        BucketsException cause = findBucketsException(error);
        return cause != null ? cause : toTransportException(what, error);
    }

    public static TransportException toTransportException(String what, Throwable error) {
        return new TransportException(what + " failed: " + error.getMessage(), error);
    }
}
