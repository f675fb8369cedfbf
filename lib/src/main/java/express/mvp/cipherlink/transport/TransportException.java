package express.mvp.cipherlink.transport;

/**
 * Unchecked exception thrown when socket-level transport operations fail.
 *
 * <p>This exception wraps I/O errors raised while binding, listening, accepting, connecting,
 * reading or writing. It extends {@link RuntimeException} to avoid cluttering method signatures
 * with checked exceptions.
 *
 * <h2>Common Causes</h2>
 *
 * <ul>
 *   <li>Connection failures (refused, reset, closed by peer mid-frame)
 *   <li>Socket timeouts on an application read
 *   <li>Address already in use when binding a server endpoint
 *   <li>Operations attempted on an endpoint in a terminal state
 * </ul>
 *
 * <h2>Error Recovery</h2>
 *
 * <p>The socket that produced the failure has already been closed when this exception reaches
 * the caller. Nothing in the transport retries automatically; a caller that wants another attempt
 * opens a fresh connection. {@link express.mvp.cipherlink.transport.error.ErrorClassifier} can
 * help decide whether that is worthwhile.
 *
 * @see express.mvp.cipherlink.transport.error.ErrorClassifier
 */
public class TransportException extends RuntimeException {

    /**
     * Constructs a new transport exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * Constructs a new transport exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new transport exception with the specified cause.
     *
     * @param cause the underlying cause of the failure
     */
    public TransportException(Throwable cause) {
        super(cause);
    }
}
