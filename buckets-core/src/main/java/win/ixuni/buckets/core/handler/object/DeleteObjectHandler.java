package win.ixuni.buckets.core.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.DeleteObjectOperation;

public class DeleteObjectHandler extends AbstractBucketsHandler<DeleteObjectOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(DeleteObjectOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().deleteObject(operation.getBucketName(), operation.getObjectName()))
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}
