package win.ixuni.buckets.core.operation.object;

import lombok.Value;
import win.ixuni.buckets.core.model.ObjectRequestOptions;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

/**
 * Replace object metadata without touching its content
 */
@Value
public class PutObjectMetadataOperation implements Operation<ObjectResponse> {

    String bucketName;

    String objectName;

    ObjectRequestOptions options;
}
