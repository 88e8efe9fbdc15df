package win.ixuni.buckets.core.operation.bucket;

import lombok.Value;
import win.ixuni.buckets.core.operation.Operation;

/**
 * Capability check: does the service expose the buckets API for this account
 */
@Value
public class CheckBucketsSupportOperation implements Operation<Boolean> {
}
