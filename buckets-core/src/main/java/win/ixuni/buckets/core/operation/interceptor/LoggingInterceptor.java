package win.ixuni.buckets.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.HandlerInterceptor;
import win.ixuni.buckets.core.operation.InterceptorChain;
import win.ixuni.buckets.core.operation.Operation;
import win.ixuni.buckets.core.operation.StreamInterceptorChain;
import win.ixuni.buckets.core.operation.StreamOperation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 日志拦截器
 * <p>
 * 在操作执行前后记录日志，包括执行时间和结果状态。Timing starts at subscription.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            ClientContext context,
            InterceptorChain<O, R> chain) {

        final String operationName = operation.getOperationName();
        final String clientName = context.getClientName();

        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            log.debug("[{}] Starting operation: {}", clientName, operationName);

            return chain.proceed(operation, context)
                    .doOnSuccess(result -> {
                        long duration = System.currentTimeMillis() - startTime;
                        log.debug("[{}] Operation {} completed successfully in {}ms",
                                clientName, operationName, duration);
                    })
                    .doOnError(error -> {
                        long duration = System.currentTimeMillis() - startTime;
                        log.warn("[{}] Operation {} failed after {}ms: {}",
                                clientName, operationName, duration, error.getMessage());
                    });
        });
    }

    @Override
    public <O extends StreamOperation<T>, T> Flux<T> interceptStream(
            O operation,
            ClientContext context,
            StreamInterceptorChain<O, T> chain) {

        final String operationName = operation.getOperationName();
        final String clientName = context.getClientName();

        return Flux.defer(() -> {
            final long startTime = System.currentTimeMillis();
            final AtomicLong records = new AtomicLong();
            log.debug("[{}] Starting stream: {}", clientName, operationName);

            return chain.proceed(operation, context)
                    .doOnNext(record -> records.incrementAndGet())
                    .doOnComplete(() -> log.debug("[{}] Stream {} completed with {} records in {}ms",
                            clientName, operationName, records.get(), System.currentTimeMillis() - startTime))
                    .doOnCancel(() -> log.debug("[{}] Stream {} cancelled after {} records",
                            clientName, operationName, records.get()))
                    .doOnError(error -> log.warn("[{}] Stream {} failed after {} records in {}ms: {}",
                            clientName, operationName, records.get(),
                            System.currentTimeMillis() - startTime, error.getMessage()));
        });
    }

    @Override
    public int getOrder() {
        return -100; // 最外层拦截器
    }
}
