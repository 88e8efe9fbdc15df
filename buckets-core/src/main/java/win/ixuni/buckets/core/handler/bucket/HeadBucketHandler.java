package win.ixuni.buckets.core.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.bucket.HeadBucketOperation;

/**
 * Head bucket handler: fails with NotFoundException when the bucket is absent
 */
public class HeadBucketHandler extends AbstractBucketsHandler<HeadBucketOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(HeadBucketOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().headBucket(operation.getBucketName()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<HeadBucketOperation> getOperationType() {
        return HeadBucketOperation.class;
    }
}
