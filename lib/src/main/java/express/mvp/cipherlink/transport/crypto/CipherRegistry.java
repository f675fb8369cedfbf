package express.mvp.cipherlink.transport.crypto;

import express.mvp.cipherlink.transport.ConfigurationException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Explicit mapping from {@link CipherType} to plugin factories.
 *
 * <p>The set of variants is closed: a registry can only hold factories for the constants of
 * {@link CipherType}. There is no class-path scanning or reflective loading. A registry other than
 * the default is useful for tests that substitute an instrumented plugin for one variant.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CipherPlugin plugin = CipherRegistry.defaultRegistry()
 *     .create(CipherConfig.of("xor", Map.of("byte", 42)));
 * }</pre>
 *
 * <p>Registries are immutable once built and safe to share.
 */
public final class CipherRegistry {

    private static final Logger LOGGER = Logger.getLogger(CipherRegistry.class.getName());

    private static final CipherRegistry DEFAULT =
            builder()
                    .register(CipherType.XOR, XorCipher::new)
                    .register(CipherType.AES_CBC, AesCbcCipher::new)
                    .register(CipherType.AES_GCM, AesGcmCipher::new)
                    .build();

    private final Map<CipherType, Function<CipherConfig, ? extends CipherPlugin>> factories;

    private CipherRegistry(Map<CipherType, Function<CipherConfig, ? extends CipherPlugin>> f) {
        this.factories = Collections.unmodifiableMap(new EnumMap<>(f));
    }

    /**
     * Returns the registry holding the built-in XOR, AES-CBC and AES-GCM plugins.
     *
     * @return the shared default registry
     */
    public static CipherRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Creates a new, empty builder.
     *
     * @return a builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the plugin selected by a configuration.
     *
     * @param config the cipher configuration
     * @return a ready plugin
     * @throws ConfigurationException if no factory is registered for the type or the parameters
     *     are invalid
     * @throws CryptoException if the key material is rejected by the JCE provider
     */
    public CipherPlugin create(CipherConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Function<CipherConfig, ? extends CipherPlugin> factory = factories.get(config.type());
        if (factory == null) {
            throw new ConfigurationException("No cipher registered for type: " + config.type());
        }
        CipherPlugin plugin = factory.apply(config);
        LOGGER.log(Level.FINE, "Created {0} for type {1}", new Object[] {plugin, config.type()});
        return plugin;
    }

    /**
     * Returns the variants this registry can build.
     *
     * @return the registered types
     */
    public Set<CipherType> registeredTypes() {
        return factories.keySet();
    }

    /** Builder for {@link CipherRegistry}. */
    public static final class Builder {
        private final Map<CipherType, Function<CipherConfig, ? extends CipherPlugin>> factories =
                new EnumMap<>(CipherType.class);

        private Builder() {}

        /**
         * Registers the factory for one variant, replacing any earlier registration.
         *
         * @param type the variant
         * @param factory builds a plugin from validated parameters
         * @return this builder for chaining
         */
        public Builder register(
                CipherType type, Function<CipherConfig, ? extends CipherPlugin> factory) {
            factories.put(
                    Objects.requireNonNull(type), Objects.requireNonNull(factory));
            return this;
        }

        /**
         * Builds the registry.
         *
         * @return a new immutable registry
         */
        public CipherRegistry build() {
            return new CipherRegistry(factories);
        }
    }
}
