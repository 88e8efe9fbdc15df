package win.ixuni.buckets.core.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.HeadObjectOperation;

/**
 * 获取对象元数据处理器; user metadata is exposed through the response headers
 */
public class HeadObjectHandler extends AbstractBucketsHandler<HeadObjectOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(HeadObjectOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().headObject(operation.getBucketName(), operation.getObjectName()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }
}
