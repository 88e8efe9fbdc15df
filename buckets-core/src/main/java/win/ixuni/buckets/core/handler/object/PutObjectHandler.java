package win.ixuni.buckets.core.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.exception.PayloadStreamException;
import win.ixuni.buckets.core.exception.TransportErrors;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.model.ObjectResponse;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.object.PutObjectOperation;
import win.ixuni.buckets.core.transport.TransportRequest;

import java.nio.ByteBuffer;

/**
 * 上传对象处理器
 * <p>
 * The payload is streamed as the request body, read on demand as the connection accepts bytes.
 * If the payload fails, or does not match the declared length, the request is aborted and the
 * caller sees {@link PayloadStreamException} rather than a server response.
 */
@Slf4j
public class PutObjectHandler extends AbstractBucketsHandler<PutObjectOperation, ObjectResponse> {

    @Override
    protected Mono<ObjectResponse> doHandle(PutObjectOperation operation, ClientContext context) {
        long declaredLength = PayloadGuard.declaredLength(operation.getOptions());
        Flux<ByteBuffer> content = operation.getContent() == null
                ? null
                : PayloadGuard.guardUpload(operation.getContent(), declaredLength);

        TransportRequest request = context.getRequestFactory().putObject(
                operation.getBucketName(), operation.getObjectName(), content, operation.getOptions());
        log.trace("Uploading {} (declared length {})", request.describe(), declaredLength);

        return context.getTransport().exchange(request)
                .onErrorMap(e -> !(e instanceof PayloadStreamException)
                                && TransportErrors.findBucketsException(e) instanceof PayloadStreamException,
                        TransportErrors::findBucketsException)
                .flatMap(ResponseSupport::expectSuccess);
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}
