package express.mvp.cipherlink.transport.security;

import java.time.Duration;
import java.util.Objects;

/**
 * Flood-protection limits applied by a {@link SecurityGuard}.
 *
 * <p>This immutable object holds the four limits an endpoint enforces per source IP.
 *
 * <table border="1">
 *   <caption>Security Policy Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>maxConnectionsPerWindow</td><td>10</td><td>Admitted connections per IP per window</td></tr>
 *   <tr><td>maxBytesPerWindow</td><td>1 MiB</td><td>Admitted bytes per IP per window; also the
 *       largest single payload</td></tr>
 *   <tr><td>socketTimeoutSeconds</td><td>10</td><td>Accept, connect and read timeout</td></tr>
 *   <tr><td>windowSeconds</td><td>60</td><td>Length of the sliding window</td></tr>
 * </table>
 */
public final class SecurityPolicy {

    /** Default admitted connections per window. */
    public static final int DEFAULT_MAX_CONNECTIONS_PER_WINDOW = 10;

    /** Default admitted bytes per window (1 MiB). */
    public static final long DEFAULT_MAX_BYTES_PER_WINDOW = 1024L * 1024L;

    /** Default socket timeout in seconds. */
    public static final int DEFAULT_SOCKET_TIMEOUT_SECONDS = 10;

    /** Largest socket timeout whose millisecond value still fits {@code SO_TIMEOUT}. */
    public static final int MAX_SOCKET_TIMEOUT_SECONDS = Integer.MAX_VALUE / 1000;

    /** Default sliding window in seconds. */
    public static final int DEFAULT_WINDOW_SECONDS = 60;

    private static final SecurityPolicy DEFAULTS = builder().build();

    private final int maxConnectionsPerWindow;
    private final long maxBytesPerWindow;
    private final int socketTimeoutSeconds;
    private final int windowSeconds;

    private SecurityPolicy(Builder builder) {
        this.maxConnectionsPerWindow = builder.maxConnectionsPerWindow;
        this.maxBytesPerWindow = builder.maxBytesPerWindow;
        this.socketTimeoutSeconds = builder.socketTimeoutSeconds;
        this.windowSeconds = builder.windowSeconds;
    }

    /**
     * Returns the policy used when configuration omits the security section.
     *
     * @return the default policy
     */
    public static SecurityPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder initialised with the defaults.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public int maxConnectionsPerWindow() {
        return maxConnectionsPerWindow;
    }

    public long maxBytesPerWindow() {
        return maxBytesPerWindow;
    }

    public int socketTimeoutSeconds() {
        return socketTimeoutSeconds;
    }

    public int windowSeconds() {
        return windowSeconds;
    }

    /**
     * Returns the socket timeout as a duration.
     *
     * @return the timeout
     */
    public Duration socketTimeout() {
        return Duration.ofSeconds(socketTimeoutSeconds);
    }

    /**
     * Returns the sliding window as a duration.
     *
     * @return the window length
     */
    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SecurityPolicy)) {
            return false;
        }
        SecurityPolicy that = (SecurityPolicy) o;
        return maxConnectionsPerWindow == that.maxConnectionsPerWindow
                && maxBytesPerWindow == that.maxBytesPerWindow
                && socketTimeoutSeconds == that.socketTimeoutSeconds
                && windowSeconds == that.windowSeconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                maxConnectionsPerWindow, maxBytesPerWindow, socketTimeoutSeconds, windowSeconds);
    }

    @Override
    public String toString() {
        return "SecurityPolicy[maxConnections=" + maxConnectionsPerWindow
                + ", maxBytes=" + maxBytesPerWindow
                + ", timeout=" + socketTimeoutSeconds + "s"
                + ", window=" + windowSeconds + "s]";
    }

    /**
     * Builder for {@link SecurityPolicy}.
     *
     * <p>All limits must be positive.
     */
    public static final class Builder {
        private int maxConnectionsPerWindow = DEFAULT_MAX_CONNECTIONS_PER_WINDOW;
        private long maxBytesPerWindow = DEFAULT_MAX_BYTES_PER_WINDOW;
        private int socketTimeoutSeconds = DEFAULT_SOCKET_TIMEOUT_SECONDS;
        private int windowSeconds = DEFAULT_WINDOW_SECONDS;

        private Builder() {}

        /**
         * Sets the number of connections admitted per IP within one window.
         *
         * @param max the limit (must be positive)
         * @return this builder for chaining
         * @throws IllegalArgumentException if max is not positive
         */
        public Builder maxConnectionsPerWindow(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxConnectionsPerWindow must be positive");
            }
            this.maxConnectionsPerWindow = max;
            return this;
        }

        /**
         * Sets the number of bytes admitted per IP within one window.
         *
         * @param max the limit (must be positive)
         * @return this builder for chaining
         * @throws IllegalArgumentException if max is not positive
         */
        public Builder maxBytesPerWindow(long max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxBytesPerWindow must be positive");
            }
            this.maxBytesPerWindow = max;
            return this;
        }

        /**
         * Sets the socket timeout.
         *
         * @param seconds the timeout, 1 to {@link #MAX_SOCKET_TIMEOUT_SECONDS}
         * @return this builder for chaining
         * @throws IllegalArgumentException if seconds is not positive or too large
         */
        public Builder socketTimeoutSeconds(int seconds) {
            if (seconds <= 0) {
                throw new IllegalArgumentException("socketTimeoutSeconds must be positive");
            }
            if (seconds > MAX_SOCKET_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("socketTimeoutSeconds must not exceed "
                        + MAX_SOCKET_TIMEOUT_SECONDS + ": " + seconds);
            }
            this.socketTimeoutSeconds = seconds;
            return this;
        }

        /**
         * Sets the sliding window length.
         *
         * @param seconds the window (must be positive)
         * @return this builder for chaining
         * @throws IllegalArgumentException if seconds is not positive
         */
        public Builder windowSeconds(int seconds) {
            if (seconds <= 0) {
                throw new IllegalArgumentException("windowSeconds must be positive");
            }
            this.windowSeconds = seconds;
            return this;
        }

        /**
         * Builds the policy.
         *
         * @return a new immutable SecurityPolicy
         */
        public SecurityPolicy build() {
            return new SecurityPolicy(this);
        }
    }
}
