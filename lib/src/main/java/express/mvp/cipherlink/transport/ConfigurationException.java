package express.mvp.cipherlink.transport;

/**
 * Unchecked exception thrown when settings are missing or invalid.
 *
 * <p>Raised at construction time only: by endpoints for a bad role, host or port, by cipher
 * plugins for missing or malformed key material, and by configuration parsing for absent or
 * malformed JSON. A configuration error is never retried; the same lookup would fail the same
 * way.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Constructs a new configuration exception with the specified message.
     *
     * @param message the detail message naming the offending setting
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified message and cause.
     *
     * @param message the detail message naming the offending setting
     * @param cause the underlying parse or decode failure
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
