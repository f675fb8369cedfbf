package express.mvp.cipherlink.transport;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.cipherlink.transport.config.ConfigSource;
import express.mvp.cipherlink.transport.config.ServiceSettings;
import express.mvp.cipherlink.transport.crypto.CipherPlugin;
import express.mvp.cipherlink.transport.crypto.CipherRegistry;
import express.mvp.cipherlink.transport.crypto.CryptoException;
import express.mvp.cipherlink.transport.error.ErrorCategory;
import express.mvp.cipherlink.transport.error.ErrorClassifier;
import express.mvp.cipherlink.transport.framing.FramingException;
import express.mvp.cipherlink.transport.framing.FramingHandler;
import express.mvp.cipherlink.transport.framing.LengthPrefixedFramingHandler;
import express.mvp.cipherlink.transport.security.SecurityGuard;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encrypted, length-prefixed request/response exchange over a connected socket.
 *
 * <h2>Wire Format</h2>
 *
 * <pre>
 * ┌──────────────────────┬──────────────────────────┐
 * │ length (uint32, BE)  │ ciphertext (length bytes) │   repeated, no other header
 * └──────────────────────┴──────────────────────────┘
 * </pre>
 *
 * <p>Every inbound length is vetted by the {@link SecurityGuard} before the body is read: it
 * must pass {@link SecurityGuard#validatePayloadLength(long)} and
 * {@link SecurityGuard#admitData(String, long)} for the peer address. A frame that fails either
 * check closes the connection without an exception.
 *
 * <h2>Error Handling</h2>
 *
 * <table border="1">
 *   <caption>Outcomes of a failed exchange</caption>
 *   <tr><th>Condition</th><th>{@link #sendAndReceive}</th><th>{@link #serve}</th></tr>
 *   <tr><td>peer closed before a header</td><td>returns empty array</td><td>returns</td></tr>
 *   <tr><td>guard rejects a frame</td><td>closes, returns empty array</td>
 *       <td>closes, returns</td></tr>
 *   <tr><td>read/write failure, timeout</td><td>closes, {@link TransportException}</td>
 *       <td>closes, returns</td></tr>
 *   <tr><td>decrypt failure</td><td>closes, {@link CryptoException}</td>
 *       <td>closes, {@link CryptoException}</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SecureChannel client = SecureChannel.open(source, "client", "1.0");
 * try (Socket socket = client.endpoint().orElseThrow().connect()) {
 *     byte[] reply = client.sendAndReceive(socket, "Hello, Server!".getBytes(UTF_8));
 * }
 * }</pre>
 *
 * <p>A channel holds no per-connection state and may serve many sockets concurrently.
 */
public final class SecureChannel implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SecureChannel.class.getName());

    private static final byte[] NO_RESPONSE = new byte[0];

    private final Endpoint endpoint;
    private final SecurityGuard securityGuard;
    private final CipherPlugin cipher;
    private final PayloadHandler payloadHandler;
    private final FramingHandler framing;

    /**
     * Creates an echoing channel on an endpoint's security guard.
     *
     * @param endpoint the endpoint whose guard vets inbound frames
     * @param cipher the cipher for every frame
     */
    public SecureChannel(Endpoint endpoint, CipherPlugin cipher) {
        this(endpoint, cipher, PayloadHandler.ECHO);
    }

    /**
     * Creates a channel on an endpoint's security guard.
     *
     * @param endpoint the endpoint whose guard vets inbound frames
     * @param cipher the cipher for every frame
     * @param payloadHandler computes responses in {@link #serve(Socket)}
     */
    public SecureChannel(Endpoint endpoint, CipherPlugin cipher, PayloadHandler payloadHandler) {
        this(Objects.requireNonNull(endpoint, "endpoint must not be null"),
                endpoint.securityGuard(), cipher, payloadHandler, null);
    }

    /**
     * Creates a channel without an endpoint, for sockets obtained elsewhere.
     *
     * @param securityGuard vets inbound frames
     * @param cipher the cipher for every frame
     * @param payloadHandler computes responses in {@link #serve(Socket)}
     * @param framing the frame codec, or null for a length-prefixed codec sized to the policy
     */
    public SecureChannel(SecurityGuard securityGuard, CipherPlugin cipher,
            PayloadHandler payloadHandler, FramingHandler framing) {
        this(null, securityGuard, cipher, payloadHandler, framing);
    }

    private SecureChannel(Endpoint endpoint, SecurityGuard securityGuard, CipherPlugin cipher,
            PayloadHandler payloadHandler, FramingHandler framing) {
        this.endpoint = endpoint;
        this.securityGuard = Objects.requireNonNull(securityGuard, "securityGuard must not be null");
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.payloadHandler = Objects.requireNonNull(payloadHandler, "payloadHandler must not be null");
        this.framing = framing != null ? framing : defaultFraming(securityGuard);
    }

    /**
     * Builds endpoint and cipher from one service's settings.
     *
     * @param source the configuration source
     * @param serviceName the service name
     * @param version the configuration version
     * @return an echoing channel; a server endpoint is already listening
     * @throws ConfigurationException if the settings are missing or invalid
     * @throws CryptoException if the key material is rejected
     * @throws TransportException if a server endpoint cannot bind
     */
    public static SecureChannel open(ConfigSource source, String serviceName, String version) {
        return open(source, serviceName, version, PayloadHandler.ECHO);
    }

    /**
     * Builds endpoint and cipher from one service's settings with a custom handler.
     *
     * @param source the configuration source
     * @param serviceName the service name
     * @param version the configuration version
     * @param payloadHandler computes responses in {@link #serve(Socket)}
     * @return the channel; a server endpoint is already listening
     */
    public static SecureChannel open(ConfigSource source, String serviceName, String version,
            PayloadHandler payloadHandler) {
        ServiceSettings settings = ServiceSettings.load(source, serviceName, version);
        EndpointConfig endpointConfig = settings.endpointConfig();
        // Resolve the cipher before binding so a bad key never leaves a listener open.
        CipherPlugin cipher = CipherRegistry.defaultRegistry().create(settings.cipherConfig());
        return new SecureChannel(new Endpoint(endpointConfig), cipher, payloadHandler);
    }

    /**
     * Sends one encrypted request and waits for one encrypted response.
     *
     * @param socket a connected socket; left open unless the exchange fails
     * @param plaintext the request
     * @return the decrypted response, or an empty array if the peer sent none or the response
     *     was rejected by the security guard
     * @throws TransportException if writing or reading fails; the socket is closed
     * @throws CryptoException if the response does not decrypt; the socket is closed
     */
    public byte[] sendAndReceive(Socket socket, byte[] plaintext) {
        String peer = Sockets.peerAddress(socket);
        byte[] ciphertext = cipher.encrypt(plaintext);
        byte[] response;
        try {
            InputStream in = socket.getInputStream();
            framing.writeFrame(socket.getOutputStream(), ciphertext);
            LOGGER.log(Level.FINE, "Sent {0} byte frame to {1}",
                    new Object[] {ciphertext.length, peer});

            long length = framing.readLength(in);
            if (length < 0) {
                LOGGER.log(Level.FINE, "No response from {0}", peer);
                return NO_RESPONSE;
            }
            if (!admitFrame(peer, length)) {
                Sockets.closeQuietly(socket);
                return NO_RESPONSE;
            }
            response = framing.readPayload(in, length);
        } catch (IOException | FramingException e) {
            Sockets.closeQuietly(socket);
            throw new TransportException("Exchange with " + peer + " failed", e);
        }
        return decryptOrClose(socket, response);
    }

    /**
     * Connects through this channel's endpoint, performs one exchange and closes the socket.
     *
     * @param plaintext the request
     * @return the decrypted response, or an empty array if there was none
     * @throws IllegalStateException if the channel was created without an endpoint
     */
    public byte[] request(byte[] plaintext) {
        if (endpoint == null) {
            throw new IllegalStateException("Channel has no endpoint");
        }
        Socket socket = endpoint.connect();
        try {
            return sendAndReceive(socket, plaintext);
        } finally {
            Sockets.closeQuietly(socket);
        }
    }

    /**
     * Serves one connection until the peer closes it.
     *
     * <p>Each frame is decrypted, passed to the {@link PayloadHandler}, and the encrypted result
     * is written back. The socket is always closed when this method returns or throws.
     *
     * @param socket the accepted socket
     * @throws CryptoException if a request does not decrypt
     */
    public void serve(Socket socket) {
        String peer = Sockets.peerAddress(socket);
        int frames = 0;
        try {
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();
            while (true) {
                long length = framing.readLength(in);
                if (length < 0) {
                    LOGGER.log(Level.FINE, "Peer {0} closed after {1} frame(s)",
                            new Object[] {peer, frames});
                    return;
                }
                if (!admitFrame(peer, length)) {
                    return;
                }
                byte[] request = cipher.decrypt(framing.readPayload(in, length));
                byte[] response = payloadHandler.handle(request);
                framing.writeFrame(out, cipher.encrypt(response));
                frames++;
            }
        } catch (IOException | FramingException e) {
            ErrorCategory category = ErrorClassifier.classify(e);
            LOGGER.log(category.logLevel(), "Connection from " + peer + " dropped: "
                    + ErrorClassifier.describeError(e));
        } finally {
            Sockets.closeQuietly(socket);
        }
    }

    private boolean admitFrame(String peer, long length) {
        return securityGuard.validatePayloadLength(length)
                && securityGuard.admitData(peer, length);
    }

    private byte[] decryptOrClose(Socket socket, byte[] ciphertext) {
        try {
            return cipher.decrypt(ciphertext);
        } catch (CryptoException e) {
            Sockets.closeQuietly(socket);
            throw e;
        }
    }

    private static FramingHandler defaultFraming(SecurityGuard guard) {
        // Outbound frames carry padding or a tag, so the codec cap stays above the guard limit.
        long max = Math.min(guard.policy().maxBytesPerWindow(),
                Integer.MAX_VALUE - LengthPrefixedFramingHandler.HEADER_SIZE);
        return new LengthPrefixedFramingHandler(
                Math.max((int) max, LengthPrefixedFramingHandler.DEFAULT_MAX_PAYLOAD_SIZE));
    }

    /**
     * Returns the endpoint this channel was built on.
     *
     * @return the endpoint, or empty for channels created from a bare guard
     */
    public Optional<Endpoint> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "guard is shared with the endpoint")
    public SecurityGuard securityGuard() {
        return securityGuard;
    }

    public CipherPlugin cipher() {
        return cipher;
    }

    public FramingHandler framing() {
        return framing;
    }

    /** Closes the endpoint, if any. */
    @Override
    public void close() {
        if (endpoint != null) {
            endpoint.close();
        }
    }

    @Override
    public String toString() {
        return "SecureChannel[cipher=" + cipher.type() + ", endpoint=" + endpoint + "]";
    }
}
