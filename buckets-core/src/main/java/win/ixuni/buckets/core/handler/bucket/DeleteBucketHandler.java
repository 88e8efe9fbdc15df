package win.ixuni.buckets.core.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.bucket.DeleteBucketOperation;

/**
 * 删除 bucket 处理器
 */
public class DeleteBucketHandler extends AbstractBucketsHandler<DeleteBucketOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(DeleteBucketOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().deleteBucket(operation.getBucketName()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}
