package win.ixuni.buckets.core.operation.object;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * 删除对象操作
 */
@Value
public class DeleteObjectOperation implements Operation<ObjectResponse> {

    String bucketName;

    String objectName;
}
