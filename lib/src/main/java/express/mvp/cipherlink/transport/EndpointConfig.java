package express.mvp.cipherlink.transport;

import express.mvp.cipherlink.transport.security.SecurityPolicy;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Resolved, immutable settings of one {@link Endpoint}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Endpoint Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>role</td><td>(required)</td><td>CLIENT or SERVER</td></tr>
 *   <tr><td>host</td><td>(required)</td><td>Bind address (server) or peer address (client)</td></tr>
 *   <tr><td>port</td><td>(required)</td><td>0..65535; 0 binds an ephemeral port</td></tr>
 *   <tr><td>securityPolicy</td><td>{@link SecurityPolicy#defaults()}</td><td>Rate limits and
 *       socket timeout</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointConfig config = EndpointConfig.builder()
 *     .role(EndpointRole.SERVER)
 *     .host("localhost")
 *     .port(5000)
 *     .securityPolicy(SecurityPolicy.builder().maxConnectionsPerWindow(5).build())
 *     .build();
 * }</pre>
 *
 * <p>Invalid values are rejected with {@link ConfigurationException} so that a bad settings
 * document and a bad programmatic configuration fail the same way.
 */
public final class EndpointConfig {

    /** Highest valid TCP port. */
    public static final int MAX_PORT = 65535;

    private final EndpointRole role;
    private final String host;
    private final int port;
    private final SecurityPolicy securityPolicy;

    private EndpointConfig(Builder builder) {
        this.role = builder.role;
        this.host = builder.host;
        this.port = builder.port;
        this.securityPolicy = builder.securityPolicy;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public EndpointRole role() {
        return role;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public SecurityPolicy securityPolicy() {
        return securityPolicy;
    }

    /**
     * Returns a copy of this configuration with a different port.
     *
     * @param newPort the port to use
     * @return a new configuration
     */
    public EndpointConfig withPort(int newPort) {
        return builder()
                .role(role)
                .host(host)
                .port(newPort)
                .securityPolicy(securityPolicy)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EndpointConfig)) {
            return false;
        }
        EndpointConfig that = (EndpointConfig) o;
        return port == that.port
                && role == that.role
                && host.equals(that.host)
                && securityPolicy.equals(that.securityPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, host, port, securityPolicy);
    }

    @Override
    public String toString() {
        return "EndpointConfig[role=" + role + ", host=" + host + ", port=" + port
                + ", security=" + securityPolicy + "]";
    }

    /** Builder for {@link EndpointConfig}. */
    public static final class Builder {
        private EndpointRole role;
        private String host;
        private int port = -1;
        private SecurityPolicy securityPolicy = SecurityPolicy.defaults();

        private Builder() {}

        public Builder role(EndpointRole role) {
            this.role = role;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > MAX_PORT) {
                throw new ConfigurationException(
                        "Invalid port: " + port + " (expected 0.." + MAX_PORT + ")");
            }
            this.port = port;
            return this;
        }

        public Builder securityPolicy(SecurityPolicy securityPolicy) {
            this.securityPolicy = Objects.requireNonNull(securityPolicy, "securityPolicy");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the immutable configuration
         * @throws ConfigurationException if role, host or port is missing, or the host does not
         *     resolve
         */
        public EndpointConfig build() {
            if (role == null) {
                throw new ConfigurationException("Endpoint role is required");
            }
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("Endpoint host is required");
            }
            if (port < 0) {
                throw new ConfigurationException("Endpoint port is required");
            }
            if (new InetSocketAddress(host, port).isUnresolved()) {
                throw new ConfigurationException("Endpoint host cannot be resolved: " + host);
            }
            return new EndpointConfig(this);
        }
    }
}
