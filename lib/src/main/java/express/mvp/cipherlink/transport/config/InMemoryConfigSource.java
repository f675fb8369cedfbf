package express.mvp.cipherlink.transport.config;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Map-backed {@link ConfigSource}.
 *
 * <p>Documents are stored verbatim and only parsed when an endpoint or cipher asks for them.
 * Registering the same key again replaces the earlier document. Thread-safe.
 */
public class InMemoryConfigSource implements ConfigSource {

    private static final Logger LOGGER = Logger.getLogger(InMemoryConfigSource.class.getName());

    private final ConcurrentMap<String, String> documents = new ConcurrentHashMap<>();

    /**
     * Registers a document.
     *
     * @param domain the service domain
     * @param serviceName the service name
     * @param version the configuration version
     * @param json the settings document
     * @return this source for chaining
     */
    public InMemoryConfigSource register(
            String domain, String serviceName, String version, String json) {
        Objects.requireNonNull(json, "json must not be null");
        documents.put(key(domain, serviceName, version), json);
        LOGGER.log(Level.FINE, "Registered configuration {0}",
                key(domain, serviceName, version));
        return this;
    }

    /**
     * Registers a document in the {@value ConfigSource#NETWORK_DOMAIN} domain.
     *
     * @param serviceName the service name
     * @param version the configuration version
     * @param json the settings document
     * @return this source for chaining
     */
    public InMemoryConfigSource registerNetwork(String serviceName, String version, String json) {
        return register(NETWORK_DOMAIN, serviceName, version, json);
    }

    @Override
    public Optional<String> lookup(String domain, String serviceName, String version) {
        String json = documents.get(key(domain, serviceName, version));
        if (json == null) {
            LOGGER.log(Level.FINE, "Configuration not found: {0}",
                    key(domain, serviceName, version));
        }
        return Optional.ofNullable(json);
    }

    /**
     * Returns the number of registered documents.
     *
     * @return the document count
     */
    public int size() {
        return documents.size();
    }

    private static String key(String domain, String serviceName, String version) {
        return Objects.requireNonNull(domain, "domain") + "/"
                + Objects.requireNonNull(serviceName, "serviceName") + "/"
                + Objects.requireNonNull(version, "version");
    }
}
