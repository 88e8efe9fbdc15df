package win.ixuni.buckets.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.buckets.core.model.ObjectRequestOptions;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.Operation;

import java.nio.ByteBuffer;

/**
 * Put object operation
 */
@Value
@Builder
public class PutObjectOperation implements Operation<ObjectResponse> {

    /**
     * Bucket 名称
     */
    String bucketName;

    /**
     * 对象名称
     */
    String objectName;

    /**
     * 对象内容流
     */
    Flux<ByteBuffer> content;

    /**
     * Content type, length, metadata and raw headers
     */
    ObjectRequestOptions options;
}
