package win.ixuni.buckets.core.operation;

import reactor.core.publisher.Flux;

/**
 * Interceptor chain for streaming operations
 *
 * @param <O> 操作类型
 * @param <T> record type
 */
public interface StreamInterceptorChain<O extends StreamOperation<T>, T> {

    Flux<T> proceed(O operation, ClientContext context);
}
