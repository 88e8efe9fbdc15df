package win.ixuni.buckets.core.transport;

import win.ixuni.buckets.core.config.ClientConfig;

/**
 * Transport factory interface
 * <p>
 * Each transport implementation provides a factory, discovered through
 * {@code META-INF/services/win.ixuni.buckets.core.transport.TransportFactory}.
 */
public interface TransportFactory {

    /**
     * Get the transport type supported by this factory
     *
     * @return transport type identifier (e.g. "webclient")
     */
    String getTransportType();

    /**
     * Create a transport instance from configuration
     *
     * @param config client configuration
     * @return transport instance
     */
    BucketsTransport createTransport(ClientConfig config);

    /**
     * Get the transport description
     *
     * @return description text
     */
    default String getDescription() {
        return getTransportType() + " transport";
    }
}
