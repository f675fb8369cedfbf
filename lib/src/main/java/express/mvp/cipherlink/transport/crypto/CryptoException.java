package express.mvp.cipherlink.transport.crypto;

/**
 * Exception thrown when encryption or decryption fails.
 *
 * <p>This exception covers two situations:
 *
 * <ul>
 *   <li><b>Key material rejected:</b> the JCE provider refuses a key, IV or nonce that passed
 *       length validation. Fatal at construction.
 *   <li><b>Integrity failure:</b> AES-GCM authentication fails, or AES-CBC padding is
 *       inconsistent. The peer is treated as hostile or corrupted and the connection is closed.
 * </ul>
 *
 * <p>A decrypt failure never yields partial plaintext.
 *
 * @see CipherPlugin
 */
public class CryptoException extends RuntimeException {

    /**
     * Constructs a new crypto exception with the specified detail message.
     *
     * @param message the detail message describing the failure
     */
    public CryptoException(String message) {
        super(message);
    }

    /**
     * Constructs a new crypto exception with the specified detail message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying JCE failure
     */
    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new crypto exception with the specified cause.
     *
     * @param cause the underlying JCE failure
     */
    public CryptoException(Throwable cause) {
        super(cause);
    }
}
