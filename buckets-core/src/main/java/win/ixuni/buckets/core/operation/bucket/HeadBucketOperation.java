package win.ixuni.buckets.core.operation.bucket;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * Check bucket existence (HEAD)
 */
@Value
public class HeadBucketOperation implements Operation<ObjectResponse> {

    /**
     * Bucket 名称
     */
    String bucketName;
}
