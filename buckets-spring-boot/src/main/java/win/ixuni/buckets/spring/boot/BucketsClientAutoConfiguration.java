package win.ixuni.buckets.spring.boot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import win.ixuni.buckets.core.client.BucketsClient;
import win.ixuni.buckets.core.config.ClientConfig;
import win.ixuni.buckets.core.operation.HandlerInterceptor;
import win.ixuni.buckets.core.transport.BucketsTransport;
import win.ixuni.buckets.core.transport.TransportFactoryLoader;

import java.util.stream.Collectors;

/**
 * Buckets 客户端自动配置
 * <p>
 * Creates a {@link BucketsClient} when {@code buckets.client.url} is set. A {@link BucketsTransport}
 * bean replaces the SPI-selected transport; {@link HandlerInterceptor} beans join the chain.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(BucketsClient.class)
@ConditionalOnProperty(prefix = "buckets.client", name = "url")
@EnableConfigurationProperties(BucketsClientProperties.class)
public class BucketsClientAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "buckets.client", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BucketsClient bucketsClient(BucketsClientProperties properties,
                                       ObjectProvider<BucketsTransport> transportProvider,
                                       ObjectProvider<HandlerInterceptor> interceptors) {
        ClientConfig config = properties.toClientConfig();
        BucketsTransport transport = transportProvider.getIfAvailable(
                () -> TransportFactoryLoader.find(config.getTransport()).createTransport(config));
        log.info("Creating buckets client bean [{}] with {} transport", config.getName(), transport.getTransportType());
        return new BucketsClient(config, transport, interceptors.orderedStream().collect(Collectors.toList()));
    }
}
