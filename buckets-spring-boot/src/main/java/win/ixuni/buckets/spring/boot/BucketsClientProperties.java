package win.ixuni.buckets.spring.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.buckets.core.config.ClientConfig;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Buckets 客户端配置
 * <p>
 * 配置示例：
 * <pre>
 * buckets:
 *   client:
 *     url: https://manta.example.com
 *     account: alice
 *     response-timeout: 30s
 *     default-headers:
 *       authorization: Signature ...
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "buckets.client")
public class BucketsClientProperties {

    /**
     * Whether to create the client bean
     */
    private boolean enabled = true;

    /**
     * 客户端实例名称（用于日志）
     */
    private String name = "default";

    /**
     * Service base URL
     */
    private String url;

    /**
     * Account owning the buckets
     */
    private String account;

    /**
     * 传输实现类型
     */
    private String transport = ClientConfig.DEFAULT_TRANSPORT;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration responseTimeout = Duration.ofSeconds(60);

    private int maxConnections = 50;

    /**
     * Longest accepted listing record line, in bytes
     */
    private int maxLineLength = 1024 * 1024;

    /**
     * Headers added to every request (authentication, user agent)
     */
    private Map<String, String> defaultHeaders = new LinkedHashMap<>();

    /**
     * Transport specific properties
     */
    private Map<String, Object> properties = new HashMap<>();

    public ClientConfig toClientConfig() {
        ClientConfig config = new ClientConfig();
        config.setName(name);
        config.setUrl(url);
        config.setAccount(account);
        config.setTransport(transport);
        config.setConnectTimeout(connectTimeout);
        config.setResponseTimeout(responseTimeout);
        config.setMaxConnections(maxConnections);
        config.setMaxLineLength(maxLineLength);
        config.setDefaultHeaders(new LinkedHashMap<>(defaultHeaders));
        config.setProperties(new HashMap<>(properties));
        return config;
    }
}
