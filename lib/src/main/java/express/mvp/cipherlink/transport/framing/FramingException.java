package express.mvp.cipherlink.transport.framing;

/**
 * Exception thrown when message framing or deframing fails.
 *
 * <p>This exception indicates protocol-level errors in the framing layer, such as:
 *
 * <ul>
 *   <li><b>Oversized messages:</b> Payload exceeds the configured maximum size
 *   <li><b>Invalid length prefix:</b> The length field announces more than the handler accepts
 *   <li><b>Truncated frame:</b> The stream ended inside a header or payload
 * </ul>
 *
 * <h2>Error Recovery</h2>
 *
 * <p>When a {@code FramingException} is caught, the connection should be closed because the byte
 * stream may be in an inconsistent state. There is no resynchronization marker in the wire format.
 *
 * <h2>Security Considerations</h2>
 *
 * <p>The maximum message size check prevents a peer from forcing a huge allocation with a forged
 * length prefix. Lengths are validated before any buffer is allocated.
 *
 * @see FramingHandler
 */
public class FramingException extends RuntimeException {

    /**
     * Constructs a new framing exception with the specified detail message.
     *
     * @param message the detail message describing the framing error
     */
    public FramingException(String message) {
        super(message);
    }

    /**
     * Constructs a new framing exception with the specified detail message and cause.
     *
     * @param message the detail message describing the framing error
     * @param cause the underlying cause of the framing error
     */
    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new framing exception with the specified cause.
     *
     * @param cause the underlying cause of the framing error
     */
    public FramingException(Throwable cause) {
        super(cause);
    }
}
