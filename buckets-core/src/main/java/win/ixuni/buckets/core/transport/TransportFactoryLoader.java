package win.ixuni.buckets.core.transport;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.buckets.core.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Transport factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover TransportFactory implementations on the classpath.
 */
@Slf4j
public final class TransportFactoryLoader {

    private TransportFactoryLoader() {
        // Utility class, not instantiable
    }

    /**
     * Load all TransportFactory implementations via SPI
     *
     * @return list of discovered factories
     */
    public static List<TransportFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Load all TransportFactory implementations via SPI
     *
     * @param classLoader class loader
     * @return list of discovered factories
     */
    public static List<TransportFactory> load(ClassLoader classLoader) {
        ServiceLoader<TransportFactory> loader = ServiceLoader.load(TransportFactory.class, classLoader);
        List<TransportFactory> factories = new ArrayList<>();

        for (TransportFactory factory : loader) {
            factories.add(factory);
            log.debug("Discovered transport factory via SPI: {} - {}",
                    factory.getTransportType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No TransportFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory for a transport type
     *
     * @param transportType transport type identifier
     * @return matching factory
     * @throws InvalidArgumentException when no factory supports the type
     */
    public static TransportFactory find(String transportType) {
        for (TransportFactory factory : load()) {
            if (factory.getTransportType().equals(transportType)) {
                return factory;
            }
        }
        throw new InvalidArgumentException("No transport registered for type: " + transportType);
    }
}
