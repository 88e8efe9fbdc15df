package win.ixuni.buckets.core.operation;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.request.RequestFactory;
import win.ixuni.buckets.core.transport.BucketsTransport;

/**
 * Client context interface
 * <p>
 * Provides shared dependencies handlers need to execute operations. Everything reachable from
 * here is either immutable or owned by the transport; per-call state stays inside the handler.
 */
public interface ClientContext {

    /**
     * 获取客户端配置
     */
    ClientConfig getConfig();

    /**
     * Get the client instance name
     */
    String getClientName();

    BucketsTransport getTransport();

    RequestFactory getRequestFactory();

    /**
     * Get the operation handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * 设置操作处理器注册表
     * <p>
     * Called during client initialization to inject the handler registry.
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute an operation
     * <p>
     * Lets handlers invoke other operations without depending on other handler instances.
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }

    default <O extends StreamOperation<T>, T> Flux<T> executeStream(O operation) {
        return getHandlerRegistry().executeStream(operation, this);
    }
}
