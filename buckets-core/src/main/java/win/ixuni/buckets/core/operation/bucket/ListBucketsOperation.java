package win.ixuni.buckets.core.operation.bucket;

import lombok.Value;
import win.ixuni.buckets.core.model.BucketEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.operation.StreamOperation;

/**
 * List buckets owned by the account
 */
@Value
public class ListBucketsOperation implements StreamOperation<BucketEntry> {

    ListOptions options;
}
