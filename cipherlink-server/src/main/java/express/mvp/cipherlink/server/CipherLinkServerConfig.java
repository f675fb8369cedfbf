package express.mvp.cipherlink.server;

import express.mvp.cipherlink.transport.PayloadHandler;
import express.mvp.cipherlink.transport.config.ConfigSource;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link CipherLinkServer} instance.
 *
 * <p>Network address, security policy and cipher come from the service's settings in the
 * {@link ConfigSource}; this class only names the service and sizes the runtime around it.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Server configuration parameters</caption>
 *   <tr><th>Option</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>configSource</td><td>(required)</td><td>Where the service settings live</td></tr>
 *   <tr><td>serviceName</td><td>server</td><td>Service to look up in the network domain</td></tr>
 *   <tr><td>version</td><td>1.0</td><td>Settings version</td></tr>
 *   <tr><td>workerThreads</td><td>0</td><td>Fixed worker count; 0 means one thread per
 *       connection</td></tr>
 *   <tr><td>payloadHandler</td><td>echo</td><td>Computes each response</td></tr>
 *   <tr><td>shutdownTimeout</td><td>5s</td><td>How long {@code stop()} waits for workers</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CipherLinkServerConfig config = CipherLinkServerConfig.builder()
 *     .configSource(DelimitedFileConfigSource.load(Path.of("services.csv")))
 *     .serviceName("server")
 *     .version("1.0")
 *     .payloadHandler(request -> transform(request))
 *     .build();
 * }</pre>
 *
 * @see CipherLinkServer
 */
public final class CipherLinkServerConfig {

    /** Default service name. */
    public static final String DEFAULT_SERVICE_NAME = "server";

    /** Default settings version. */
    public static final String DEFAULT_VERSION = "1.0";

    /** Default time {@link CipherLinkServer#stop()} waits for workers. */
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ConfigSource configSource;
    private final String serviceName;
    private final String version;
    private final int workerThreads;
    private final PayloadHandler payloadHandler;
    private final Duration shutdownTimeout;

    private CipherLinkServerConfig(Builder builder) {
        this.configSource = builder.configSource;
        this.serviceName = builder.serviceName;
        this.version = builder.version;
        this.workerThreads = builder.workerThreads;
        this.payloadHandler = builder.payloadHandler;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public ConfigSource getConfigSource() {
        return configSource;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns the fixed number of worker threads.
     *
     * @return the worker count, or 0 for one thread per connection
     */
    public int getWorkerThreads() {
        return workerThreads;
    }

    public PayloadHandler getPayloadHandler() {
        return payloadHandler;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "CipherLinkServerConfig[service=" + serviceName + "/" + version
                + ", workerThreads=" + workerThreads
                + ", shutdownTimeout=" + shutdownTimeout + "]";
    }

    /** Builder for {@link CipherLinkServerConfig}. */
    public static final class Builder {
        private ConfigSource configSource;
        private String serviceName = DEFAULT_SERVICE_NAME;
        private String version = DEFAULT_VERSION;
        private int workerThreads = 0;
        private PayloadHandler payloadHandler = PayloadHandler.ECHO;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        private Builder() {}

        public Builder configSource(ConfigSource configSource) {
            this.configSource = Objects.requireNonNull(configSource, "configSource");
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
            return this;
        }

        public Builder version(String version) {
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        /**
         * Sets a fixed worker count.
         *
         * @param workerThreads number of workers, or 0 for one thread per connection
         * @return this builder
         */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 0) {
                throw new IllegalArgumentException("workerThreads must not be negative");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder payloadHandler(PayloadHandler payloadHandler) {
            this.payloadHandler = Objects.requireNonNull(payloadHandler, "payloadHandler");
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must not be negative");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalStateException if no config source was set
         */
        public CipherLinkServerConfig build() {
            if (configSource == null) {
                throw new IllegalStateException("configSource is required");
            }
            return new CipherLinkServerConfig(this);
        }
    }
}
