package win.ixuni.buckets.core.transport;

/**
 * HTTP methods used by the buckets API
 */
public enum HttpMethod {
    GET,
    HEAD,
    PUT,
    DELETE
}
