package win.ixuni.buckets.core.operation;

import reactor.core.publisher.Flux;

/**
 * Handler for a streaming operation
 *
 * @param <O> 操作类型
 * @param <T> record type
 */
public interface StreamOperationHandler<O extends StreamOperation<T>, T> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   客户端上下文
     * @return cold record stream
     */
    Flux<T> handle(O operation, ClientContext context);

    Class<O> getOperationType();
}
