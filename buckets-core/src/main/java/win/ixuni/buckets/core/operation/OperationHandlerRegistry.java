package win.ixuni.buckets.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operation handler registry
 * <p>
 * Manages the mapping between operations and their handlers.
 * 客户端初始化时注册处理器，运行时根据操作类型查找并执行。
 * <p>
 * Supports interceptor chains, allowing common logic before and after handler execution.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final Map<Class<?>, StreamOperationHandler<?, ?>> streamHandlers = new ConcurrentHashMap<>();
    private final List<HandlerInterceptor> interceptors = new CopyOnWriteArrayList<>();

    /**
     * Register an operation handler
     *
     * @param handler 处理器实例
     * @param <O>     操作类型
     * @param <R>     返回类型
     */
    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        handlers.put(operationType, handler);
        log.debug("Registered handler for operation: {}", operationType.getSimpleName());
    }

    /**
     * Register a streaming operation handler
     */
    public <O extends StreamOperation<T>, T> void register(StreamOperationHandler<O, T> handler) {
        Class<O> operationType = handler.getOperationType();
        streamHandlers.put(operationType, handler);
        log.debug("Registered stream handler for operation: {}", operationType.getSimpleName());
    }

    /**
     * 添加拦截器
     * <p>
     * 拦截器按 order 排序，order 越小越先执行。
     *
     * @param interceptor 拦截器实例
     */
    public void addInterceptor(HandlerInterceptor interceptor) {
        interceptors.add(interceptor);
        // 重新排序（CopyOnWriteArrayList 需要手动排序）
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors.clear();
        interceptors.addAll(sorted);
        log.debug("Added interceptor: {} with order {}",
                interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * 获取操作处理器
     *
     * @return 处理器实例，不存在时返回 null
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> OperationHandler<O, R> getHandler(Class<O> operationType) {
        return (OperationHandler<O, R>) handlers.get(operationType);
    }

    @SuppressWarnings("unchecked")
    public <O extends StreamOperation<T>, T> StreamOperationHandler<O, T> getStreamHandler(Class<O> operationType) {
        return (StreamOperationHandler<O, T>) streamHandlers.get(operationType);
    }

    /**
     * Execute an operation
     * <p>
     * 根据操作类型查找处理器，并通过拦截器链执行。
     *
     * @param operation the operation instance
     * @param context   客户端上下文
     * @return operation result
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, ClientContext context) {
        Class<O> operationType = (Class<O>) operation.getClass();
        OperationHandler<O, R> handler = getHandler(operationType);

        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operationType.getSimpleName()));
        }

        log.trace("Executing operation: {} with handler: {} through {} interceptors",
                operation.getOperationName(), handler.getClass().getSimpleName(), interceptors.size());

        InterceptorChain<O, R> chain = buildChain(handler, 0);
        return chain.proceed(operation, context);
    }

    /**
     * Execute a streaming operation through the interceptor chain
     */
    @SuppressWarnings("unchecked")
    public <O extends StreamOperation<T>, T> Flux<T> executeStream(O operation, ClientContext context) {
        Class<O> operationType = (Class<O>) operation.getClass();
        StreamOperationHandler<O, T> handler = getStreamHandler(operationType);

        if (handler == null) {
            return Flux.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operationType.getSimpleName()));
        }

        StreamInterceptorChain<O, T> chain = buildStreamChain(handler, 0);
        return chain.proceed(operation, context);
    }

    /**
     * 构建拦截器链
     * <p>
     * Recursively builds the interceptor chain from the current index, falling back to handler execution.
     */
    private <O extends Operation<R>, R> InterceptorChain<O, R> buildChain(
            OperationHandler<O, R> handler, int index) {
        if (index >= interceptors.size()) {
            // Chain end: invoke actual handler
            return handler::handle;
        }

        HandlerInterceptor interceptor = interceptors.get(index);
        InterceptorChain<O, R> nextChain = buildChain(handler, index + 1);

        return (op, ctx) -> interceptor.intercept(op, ctx, nextChain);
    }

    private <O extends StreamOperation<T>, T> StreamInterceptorChain<O, T> buildStreamChain(
            StreamOperationHandler<O, T> handler, int index) {
        if (index >= interceptors.size()) {
            return handler::handle;
        }

        HandlerInterceptor interceptor = interceptors.get(index);
        StreamInterceptorChain<O, T> nextChain = buildStreamChain(handler, index + 1);

        return (op, ctx) -> interceptor.interceptStream(op, ctx, nextChain);
    }

    /**
     * 检查是否支持某个操作
     *
     * @param operationType 操作类型
     * @return true if supported
     */
    public boolean supports(Class<? extends BucketsOperation> operationType) {
        return handlers.containsKey(operationType) || streamHandlers.containsKey(operationType);
    }

    /**
     * Get the number of registered operations
     */
    public int size() {
        return handlers.size() + streamHandlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }

    /**
     * Operation kinds that have a registered handler
     */
    public Set<BucketsOperationKind> getSupportedKinds() {
        Set<BucketsOperationKind> kinds = EnumSet.noneOf(BucketsOperationKind.class);
        for (BucketsOperationKind kind : BucketsOperationKind.values()) {
            if (supports(kind.getOperationType())) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
