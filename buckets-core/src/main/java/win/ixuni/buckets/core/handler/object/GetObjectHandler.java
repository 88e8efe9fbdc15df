package win.ixuni.buckets.core.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectDownload;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.GetObjectOperation;
import win.ixuni.buckets.core.transport.TransportRequest;

/**
 * 获取对象处理器
 * <p>
 * Resolves as soon as the response headers arrive; the body is handed to the caller unread.
 */
public class GetObjectHandler extends AbstractBucketsHandler<GetObjectOperation, ObjectDownload> {

    @Override
    protected Mono<ObjectDownload> doHandle(GetObjectOperation operation, ClientContext context) {
        TransportRequest request = context.getRequestFactory()
                .getObject(operation.getBucketName(), operation.getObjectName());

        return context.getTransport().exchange(request).flatMap(response -> {
            if (!response.isSuccess()) {
                return ResponseSupport.statusError(response);
            }
            return Mono.just(ObjectDownload.builder()
                    .status(response.getStatus())
                    .headers(response.getHeaders())
                    .content(PayloadGuard.guardDownload(response.getBody(),
                            response.getHeaders().getContentLength(), request.describe()))
                    .build());
        });
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}
