package win.ixuni.buckets.core.operation;

import reactor.core.publisher.Mono;

/**
 * Operation handler interface
 * <p>
 * Uses generics to ensure type safety.
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   客户端上下文
     * @return operation result
     */
    Mono<R> handle(O operation, ClientContext context);

    /**
     * 获取此处理器支持的操作类型
     *
     * @return 操作类类型
     */
    Class<O> getOperationType();
}
