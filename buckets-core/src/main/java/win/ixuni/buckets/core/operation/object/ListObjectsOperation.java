package win.ixuni.buckets.core.operation.object;

import lombok.Value;
import win.ixuni.buckets.core.model.BucketObjectEntry;
import win.ixuni.buckets.core.model.ListOptions;
import win.ixuni.buckets.core.operation.StreamOperation;

/**
 * List objects in a bucket
 */
@Value
public class ListObjectsOperation implements StreamOperation<BucketObjectEntry> {

    String bucketName;

    ListOptions options;
}
