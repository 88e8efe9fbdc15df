package win.ixuni.buckets.core.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.handler.AbstractBucketsHandler;
import win.ixuni.buckets.core.handler.ResponseSupport;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.bucket.CheckBucketsSupportOperation;

import java.util.Set;

/**
 * Checks the account's buckets root to see whether the server speaks the buckets API
 */
public class CheckBucketsSupportHandler extends AbstractBucketsHandler<CheckBucketsSupportOperation, Boolean> {

    /**
     * Statuses meaning the endpoint exists but has no buckets API
     */
    static final Set<Integer> UNSUPPORTED_STATUSES = Set.of(404, 405, 501);

    @Override
    protected Mono<Boolean> doHandle(CheckBucketsSupportOperation operation, ClientContext context) {
        return context.getTransport()
                .exchange(context.getRequestFactory().bucketsSupportRequest())
                .flatMap(response -> {
                    if (response.isSuccess()) {
                        return response.getBody().then(Mono.just(Boolean.TRUE));
                    }
                    if (UNSUPPORTED_STATUSES.contains(response.getStatus())) {
                        return response.getBody().then(Mono.just(Boolean.FALSE));
                    }
                    return ResponseSupport.statusError(response);
                });
    }

    @Override
    public Class<CheckBucketsSupportOperation> getOperationType() {
        return CheckBucketsSupportOperation.class;
    }
}
