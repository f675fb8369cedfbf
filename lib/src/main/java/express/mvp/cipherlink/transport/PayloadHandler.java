package express.mvp.cipherlink.transport;

/**
 * Turns one decrypted request into the plaintext response sent back by
 * {@link SecureChannel#serve(java.net.Socket)}.
 *
 * <p>Invoked on the connection's worker thread, once per frame, in frame order. Returning an
 * empty array sends an empty encrypted response; throwing closes the connection.
 */
@FunctionalInterface
public interface PayloadHandler {

    /** Echoes every request unchanged. */
    PayloadHandler ECHO = request -> request;

    /**
     * Handles one request.
     *
     * @param request the decrypted request payload
     * @return the response payload to encrypt and send
     */
    byte[] handle(byte[] request);
}
