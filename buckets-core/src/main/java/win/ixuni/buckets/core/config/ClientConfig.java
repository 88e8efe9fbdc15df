package win.ixuni.buckets.core.config;

import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client configuration
 * <p>
 * Generic configuration structure shared by the client and its transport. Transport specific
 * settings go into {@link #properties}.
 */
@Data
public class ClientConfig {

    public static final String DEFAULT_TRANSPORT = "webclient";

    /**
     * Client instance name, used in logs
     */
    private String name = "default";

    /**
     * Service base URL, e.g. https://us-central.manta.example.com
     */
    private String url;

    /**
     * Account (login) owning the buckets; first path segment of every request
     */
    private String account;

    /**
     * Transport type looked up through SPI
     */
    private String transport = DEFAULT_TRANSPORT;

    /**
     * TCP connect timeout
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Maximum wait for response headers and between body reads
     */
    private Duration responseTimeout = Duration.ofSeconds(60);

    /**
     * Connection pool size
     */
    private int maxConnections = 50;

    /**
     * Longest accepted line in a listing stream
     */
    private int maxLineLength = 1024 * 1024;

    /**
     * Headers added to every request (e.g. a pre-computed authorization header)
     */
    private Map<String, String> defaultHeaders = new LinkedHashMap<>();

    /**
     * Transport-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get an integer configuration value
     */
    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Get a long integer configuration value
     */
    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * Get a boolean configuration value
     */
    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Get a duration configuration value; plain numbers are milliseconds
     */
    public Duration getDuration(String key, Duration defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(((Number) value).longValue());
        }
        String text = value.toString().trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(text));
        }
        return Duration.parse(text);
    }
}
