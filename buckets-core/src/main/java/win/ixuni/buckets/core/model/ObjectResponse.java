package win.ixuni.buckets.core.model;

import lombok.Value;

/**
 * Result of an exchange without a response body (create, head, delete, metadata update)
 */
@Value
public class ObjectResponse {

    int status;

    ResponseHeaders headers;
}
