package win.ixuni.buckets.core.client;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.operation.ClientContext;
import win.ixuni.buckets.core.operation.OperationHandlerRegistry;
import win.ixuni.buckets.core.request.RequestFactory;
import win.ixuni.buckets.core.transport.BucketsTransport;

/**
 * 客户端上下文
 * <p>
 * Holds the configuration, the transport and the request factory shared by all handlers.
 */
@Getter
@Builder
public class DefaultClientContext implements ClientContext {

    private final ClientConfig config;

    private final BucketsTransport transport;

    private final RequestFactory requestFactory;

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getClientName() {
        return config.getName();
    }
}
