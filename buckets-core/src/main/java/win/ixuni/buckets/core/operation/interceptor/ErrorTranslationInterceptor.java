package win.ixuni.buckets.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.exception.BucketsException;
import win.ixuni.buckets.core.exception.TransportErrors;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.HandlerInterceptor;
import win.ixuni.buckets.core.operation.InterceptorChain;
import win.ixuni.buckets.core.operation.Operation;
import win.ixuni.buckets.core.operation.StreamInterceptorChain;
import win.ixuni.buckets.core.operation.StreamOperation;

/**
 * Error translation interceptor
 * <p>
 * Converts I/O and timeout failures that escaped the transport into {@code TransportException}
 * and unwraps buckets exceptions that an HTTP client wrapped on the way out. Anything else
 * passes through unchanged.
 */
@Slf4j
public class ErrorTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, ClientContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(ErrorTranslationInterceptor::needsTranslation, e -> translate(operation.getOperationName(), e));
    }

    @Override
    public <O extends StreamOperation<T>, T> Flux<T> interceptStream(
            O operation, ClientContext context, StreamInterceptorChain<O, T> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(ErrorTranslationInterceptor::needsTranslation, e -> translate(operation.getOperationName(), e));
    }

    static boolean needsTranslation(Throwable error) {
        if (error instanceof BucketsException) {
            return false;
        }
        return TransportErrors.findBucketsException(error) != null || TransportErrors.isNetworkFailure(error);
    }

    private Throwable translate(String operationName, Throwable error) {
        log.debug("Translating {} from {}", error.getClass().getSimpleName(), operationName);
        return TransportErrors.translate(operationName, error);
    }

    @Override
    public int getOrder() {
        // Execute at chain end (exception conversion should be handled last)
        return 100;
    }
}
