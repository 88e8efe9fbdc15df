package win.ixuni.buckets.core.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.PutObjectMetadataOperation;

/**
 * 更新对象元数据处理器
 * <p>
 * The server replaces the whole user metadata set; keys not sent are dropped.
 */
public class PutObjectMetadataHandler extends AbstractBucketsHandler<PutObjectMetadataOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(PutObjectMetadataOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().putObjectMetadata(
                        operation.getBucketName(), operation.getObjectName(), operation.getOptions()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<PutObjectMetadataOperation> getOperationType() {
        return PutObjectMetadataOperation.class;
    }
}
