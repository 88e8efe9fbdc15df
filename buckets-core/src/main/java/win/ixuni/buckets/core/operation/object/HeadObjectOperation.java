package win.ixuni.buckets.core.operation.object;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * 获取对象元数据操作（不含数据）
 */
@Value
public class HeadObjectOperation implements Operation<ObjectResponse> {

    String bucketName;

    String objectName;
}
