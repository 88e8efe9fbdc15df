package win.ixuni.buckets.transport.webclient;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.transport.BucketsTransport;
import win.ixuni.buckets.core.transport.TransportFactory;

/**
 * WebClient transport factory
 * <p>
 * 默认传输实现，基于 Spring WebFlux WebClient 和 Reactor Netty。
 */
@Slf4j
public class WebClientTransportFactory implements TransportFactory {

    public static final String TRANSPORT_TYPE = ClientConfig.DEFAULT_TRANSPORT;

    @Override
    public String getTransportType() {
        return TRANSPORT_TYPE;
    }

    @Override
    public BucketsTransport createTransport(ClientConfig config) {
        log.info("Creating WebClient transport for client: {}", config.getName());
        return new WebClientTransport(config);
    }

    @Override
    public String getDescription() {
        return "Spring WebFlux WebClient over Reactor Netty";
    }
}
