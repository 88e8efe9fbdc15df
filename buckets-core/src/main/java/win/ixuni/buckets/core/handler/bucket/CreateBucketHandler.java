package win.ixuni.buckets.core.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.bucket.CreateBucketOperation;

/**
 * 创建 bucket 处理器
 */
public class CreateBucketHandler extends AbstractBucketsHandler<CreateBucketOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(CreateBucketOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().createBucket(operation.getBucketName()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}
