package express.mvp.cipherlink.transport.error;

import java.util.logging.Level;

/**
 * Categories of transport errors for handling and recovery decisions.
 *
 * <ul>
 *   <li><b>TRANSIENT:</b> a timeout; the same operation may succeed later
 *   <li><b>NETWORK:</b> the socket is gone; open a new connection
 *   <li><b>PROTOCOL:</b> the peer sent something that is not a valid frame
 *   <li><b>SECURITY:</b> decryption or authentication failed, or key material was rejected
 *   <li><b>CONFIGURATION:</b> settings are missing or invalid; fix them and restart
 *   <li><b>FATAL:</b> JVM errors, no recovery possible
 * </ul>
 *
 * <p>Nothing in this library retries automatically. The category is a hint for callers that
 * implement their own policy, and tells the server at which level to log a dropped connection.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     byte[] reply = channel.sendAndReceive(socket, request);
 * } catch (RuntimeException e) {
 *     ErrorCategory category = ErrorClassifier.classify(e);
 *     if (category.isRetryable()) {
 *         // open a new connection and try again
 *     } else {
 *         throw e;
 *     }
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 */
public enum ErrorCategory {

    /** Socket or accept timeout. */
    TRANSIENT(true, Level.FINE, "Transient error - may succeed on retry"),

    /** Connection refused, reset or closed by the peer. */
    NETWORK(true, Level.INFO, "Network error - reconnection required"),

    /** Negative, oversized or truncated frames. */
    PROTOCOL(false, Level.WARNING, "Protocol error - invalid framing"),

    /**
     * Padding or authentication failure on decrypt, or key material rejected by the crypto
     * provider. Usually means the peers disagree on the key.
     */
    SECURITY(false, Level.WARNING, "Security error - decryption or key failure"),

    /** Missing or invalid settings. */
    CONFIGURATION(false, Level.SEVERE, "Configuration error - fix settings"),

    /** JVM errors such as {@link OutOfMemoryError}. */
    FATAL(false, Level.SEVERE, "Fatal error - shutdown required"),

    /** Unclassified. Treated conservatively as retryable. */
    UNKNOWN(true, Level.WARNING, "Unknown error - conservative retry");

    private final boolean retryable;
    private final Level logLevel;
    private final String description;

    ErrorCategory(boolean retryable, Level logLevel, String description) {
        this.retryable = retryable;
        this.logLevel = logLevel;
        this.description = description;
    }

    /**
     * Checks if errors in this category are generally retryable.
     *
     * @return true if retry is generally appropriate
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns the level at which a connection dropped for this reason is logged.
     *
     * @return the log level
     */
    public Level logLevel() {
        return logLevel;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Checks if a server should stop instead of serving further connections.
     *
     * @return true for CONFIGURATION and FATAL
     */
    public boolean stopsServer() {
        return this == CONFIGURATION || this == FATAL;
    }

    /**
     * Checks if this is a fatal error requiring shutdown.
     *
     * @return true only for FATAL category
     */
    public boolean isFatal() {
        return this == FATAL;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
