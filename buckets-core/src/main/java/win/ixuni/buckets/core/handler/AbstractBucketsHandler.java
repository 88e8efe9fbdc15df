package win.ixuni.buckets.core.handler;

import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.Operation;
import win.ixuni.buckets.core.operation.OperationHandler;

/**
 * Buckets Handler 抽象基类
 * <p>
 * Defers request construction to subscription time, so argument errors are delivered through
 * the returned {@code Mono} and nothing is built or sent until the caller subscribes.
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractBucketsHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, ClientContext context) {
        return Mono.defer(() -> doHandle(operation, context));
    }

    /**
     * 子类实现的处理方法
     *
     * @param operation 操作
     * @param context   客户端上下文
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, ClientContext context);
}
