package win.ixuni.buckets.core.operation.bucket;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * 删除 Bucket 操作
 */
@Value
public class DeleteBucketOperation implements Operation<ObjectResponse> {

    /**
     * Bucket 名称
     */
    String bucketName;
}
