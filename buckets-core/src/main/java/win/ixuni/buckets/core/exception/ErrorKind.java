package win.ixuni.buckets.core.exception;

/**
 * Stable error categories surfaced to callers
 * <p>
 * Callers should branch on the kind rather than on exception class names or messages.
 */
public enum ErrorKind {

    /**
     * Bad local input, never sent over the network
     */
    INVALID_ARGUMENT,

    /**
     * Connection, I/O or timeout failure reported by the transport
     */
    TRANSPORT,

    /**
     * The service answered with a non-success status
     */
    HTTP_STATUS,

    /**
     * The service answered 404 for the addressed bucket or object
     */
    NOT_FOUND,

    /**
     * Malformed listing stream content
     */
    DECODE,

    /**
     * The local upload source failed mid-transfer
     */
    PAYLOAD_STREAM,

    /**
     * The client was closed before the operation started
     */
    CLIENT_CLOSED
}
