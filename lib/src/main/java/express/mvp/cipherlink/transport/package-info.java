/**
 * Secure framed transport over TCP.
 *
 * <p>An {@link express.mvp.cipherlink.transport.Endpoint} produces connected sockets for its
 * role, admitting server-side peers through a
 * {@link express.mvp.cipherlink.transport.security.SecurityGuard}. A
 * {@link express.mvp.cipherlink.transport.SecureChannel} encrypts each payload with a
 * {@link express.mvp.cipherlink.transport.crypto.CipherPlugin} and exchanges it as one
 * length-prefixed frame.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConfigSource source = DelimitedFileConfigSource.load(Path.of("services.csv"));
 *
 * // server side
 * SecureChannel server = SecureChannel.open(source, "server", "1.0");
 * server.serve(server.endpoint().orElseThrow().connect());
 *
 * // client side
 * SecureChannel client = SecureChannel.open(source, "client", "1.0");
 * byte[] reply = client.request("Hello, Server!".getBytes(StandardCharsets.UTF_8));
 * }</pre>
 *
 * <p>All failures surface as unchecked exceptions:
 * {@link express.mvp.cipherlink.transport.ConfigurationException},
 * {@link express.mvp.cipherlink.transport.TransportException} and
 * {@link express.mvp.cipherlink.transport.crypto.CryptoException}.
 */
package express.mvp.cipherlink.transport;
