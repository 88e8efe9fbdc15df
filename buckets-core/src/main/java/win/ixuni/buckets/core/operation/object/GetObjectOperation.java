package win.ixuni.buckets.core.operation.object;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectDownload;
import win.ixuni.buckets.core.operation.Operation;

/**
 * 获取对象操作
 */
@Value
public class GetObjectOperation implements Operation<ObjectDownload> {

    String bucketName;

    String objectName;
}
