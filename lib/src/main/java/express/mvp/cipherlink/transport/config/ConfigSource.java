package express.mvp.cipherlink.transport.config;

import java.util.Optional;

/**
 * Lookup of JSON settings by {@code (domain, serviceName, version)}.
 *
 * <p>This is the narrow view the transport takes of the configuration store. Endpoints and cipher
 * plugins ask for the {@value #NETWORK_DOMAIN} domain only. The returned document either carries
 * the settings at its root:
 *
 * <pre>{@code
 * {"role": "server", "host": "localhost", "port": 5000,
 *  "security": {"max_connections_per_window": 10},
 *  "crypto": {"type": "xor", "params": {"byte": 42}}}
 * }</pre>
 *
 * <p>or wraps them in a {@code settings} object next to the lookup key:
 *
 * <pre>{@code
 * {"service_type": "network", "service_name": "server", "version": "1.0",
 *  "settings": {"role": "server", ...}}
 * }</pre>
 *
 * @see InMemoryConfigSource
 * @see DelimitedFileConfigSource
 */
@FunctionalInterface
public interface ConfigSource {

    /** The domain under which network services are registered. */
    String NETWORK_DOMAIN = "network";

    /**
     * Looks up a configuration document.
     *
     * @param domain the service domain, e.g. {@code "network"}
     * @param serviceName the service name, e.g. {@code "server"}
     * @param version the configuration version, e.g. {@code "1.0"}
     * @return the JSON document, or empty if none is registered
     */
    Optional<String> lookup(String domain, String serviceName, String version);
}
