package express.mvp.cipherlink.transport.config;

import express.mvp.cipherlink.transport.ConfigurationException;
import express.mvp.cipherlink.transport.EndpointConfig;
import express.mvp.cipherlink.transport.EndpointRole;
import express.mvp.cipherlink.transport.crypto.CipherConfig;
import express.mvp.cipherlink.transport.security.SecurityPolicy;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view of one service's network settings.
 *
 * <h2>Document Layout</h2>
 *
 * <pre>
 * role      "client" | "server"                         required
 * host      string                                      required
 * port      integer 0..65535                            required
 * security  {max_connections_per_window | max_connections_per_ip,
 *            max_bytes_per_window       | max_data_per_ip,
 *            socket_timeout_seconds     | timeout,
 *            window_seconds             | rate_window}    optional, each key defaulted
 * crypto    {type: "xor" | "aes-cbc" | "aes-gcm", params: {...}}
 * </pre>
 *
 * <p>If the document has a {@code settings} object at its root, that object is used instead.
 * Sections are validated lazily: an endpoint only needs {@link #endpointConfig()} and a cipher
 * only needs {@link #cipherConfig()}.
 */
public final class ServiceSettings {

    private static final String SETTINGS = "settings";
    private static final String SECURITY = "security";
    private static final String CRYPTO = "crypto";

    private final String serviceName;
    private final String version;
    private final Map<String, Object> settings;

    private ServiceSettings(String serviceName, String version, Map<String, Object> settings) {
        this.serviceName = serviceName;
        this.version = version;
        this.settings = Collections.unmodifiableMap(settings);
    }

    /**
     * Looks up and parses the settings of a network service.
     *
     * @param source the configuration source
     * @param serviceName the service name
     * @param version the configuration version
     * @return the parsed settings
     * @throws ConfigurationException if no document is registered or it is malformed
     */
    public static ServiceSettings load(ConfigSource source, String serviceName, String version) {
        Objects.requireNonNull(source, "source must not be null");
        String json = source.lookup(ConfigSource.NETWORK_DOMAIN, serviceName, version)
                .orElseThrow(() -> new ConfigurationException(
                        "No configuration for " + ConfigSource.NETWORK_DOMAIN + "/"
                                + serviceName + "/" + version));
        return parse(serviceName, version, json);
    }

    /**
     * Parses a settings document directly.
     *
     * @param serviceName the service name, used in error messages
     * @param version the configuration version, used in error messages
     * @param json the document
     * @return the parsed settings
     * @throws ConfigurationException if the document is malformed
     */
    public static ServiceSettings parse(String serviceName, String version, String json) {
        Map<String, Object> root;
        try {
            root = JsonSettings.parseObject(json);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(
                    "Invalid configuration for " + serviceName + "/" + version + ": "
                            + e.getMessage(), e);
        }
        Object wrapped = root.get(SETTINGS);
        if (wrapped != null) {
            root = asObject(wrapped, SETTINGS);
        }
        return new ServiceSettings(serviceName, version, root);
    }

    public String serviceName() {
        return serviceName;
    }

    public String version() {
        return version;
    }

    /**
     * Resolves the endpoint section: role, host, port and security.
     *
     * @return the endpoint configuration
     * @throws ConfigurationException if a key is missing or invalid
     */
    public EndpointConfig endpointConfig() {
        Object role = settings.get("role");
        if (!(role instanceof String)) {
            throw error("'role' must be a string, got: " + role);
        }
        Object host = settings.get("host");
        if (!(host instanceof String)) {
            throw error("'host' must be a string, got: " + host);
        }
        long port = integer(settings, "port");
        if (port < 0 || port > EndpointConfig.MAX_PORT) {
            throw error("Invalid port: " + port);
        }
        return EndpointConfig.builder()
                .role(EndpointRole.fromString((String) role))
                .host((String) host)
                .port((int) port)
                .securityPolicy(securityPolicy())
                .build();
    }

    /**
     * Resolves the security section. Absent keys take the {@link SecurityPolicy} defaults; the
     * original short key names are accepted as aliases.
     *
     * @return the security policy
     * @throws ConfigurationException if a present value is not a positive integer
     */
    public SecurityPolicy securityPolicy() {
        Object section = settings.get(SECURITY);
        if (section == null) {
            return SecurityPolicy.defaults();
        }
        Map<String, Object> security = asObject(section, SECURITY);
        SecurityPolicy.Builder builder = SecurityPolicy.builder();
        try {
            Long connections = optionalInteger(
                    security, "max_connections_per_window", "max_connections_per_ip");
            if (connections != null) {
                builder.maxConnectionsPerWindow(toInt(connections, "max_connections_per_window"));
            }
            Long bytes = optionalInteger(security, "max_bytes_per_window", "max_data_per_ip");
            if (bytes != null) {
                builder.maxBytesPerWindow(bytes);
            }
            Long timeout = optionalInteger(security, "socket_timeout_seconds", "timeout");
            if (timeout != null) {
                builder.socketTimeoutSeconds(toInt(timeout, "socket_timeout_seconds"));
            }
            Long window = optionalInteger(security, "window_seconds", "rate_window");
            if (window != null) {
                builder.windowSeconds(toInt(window, "window_seconds"));
            }
        } catch (IllegalArgumentException e) {
            throw error("Invalid security settings: " + e.getMessage());
        }
        return builder.build();
    }

    /**
     * Resolves the crypto section.
     *
     * @return the cipher configuration
     * @throws ConfigurationException if the section is missing or names an unknown type
     */
    public CipherConfig cipherConfig() {
        Object section = settings.get(CRYPTO);
        if (section == null) {
            throw error("Missing 'crypto' section");
        }
        Map<String, Object> crypto = asObject(section, CRYPTO);
        Object type = crypto.get("type");
        if (!(type instanceof String)) {
            throw error("'crypto.type' must be a string, got: " + type);
        }
        Object params = crypto.get("params");
        Map<String, Object> paramMap =
                params == null ? Map.of() : asObject(params, "crypto.params");
        return CipherConfig.of((String) type, paramMap);
    }

    private long integer(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Integer || value instanceof Long)) {
            throw error("'" + key + "' must be an integer, got: " + value);
        }
        return ((Number) value).longValue();
    }

    private Long optionalInteger(Map<String, Object> map, String key, String alias) {
        String present = map.containsKey(key) ? key : map.containsKey(alias) ? alias : null;
        return present == null ? null : integer(map, present);
    }

    private int toInt(long value, String key) {
        if (value > Integer.MAX_VALUE) {
            throw error("'" + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value, String name) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + name + "' must be a JSON object");
        }
        return (Map<String, Object>) value;
    }

    private ConfigurationException error(String message) {
        return new ConfigurationException(serviceName + "/" + version + ": " + message);
    }

    @Override
    public String toString() {
        return "ServiceSettings[" + serviceName + "/" + version + ", keys=" + settings.keySet()
                + "]";
    }
}
