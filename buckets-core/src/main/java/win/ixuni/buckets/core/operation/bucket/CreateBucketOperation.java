package win.ixuni.buckets.core.operation.bucket;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * 创建 Bucket 操作
 */
@Value
public class CreateBucketOperation implements Operation<ObjectResponse> {

    /**
     * Bucket 名称
     */
    String bucketName;
}
