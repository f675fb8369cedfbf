/**
 * Symmetric cipher plugins.
 *
 * <p>The set of ciphers is closed ({@link express.mvp.cipherlink.transport.crypto.CipherType})
 * and construction goes through
 * {@link express.mvp.cipherlink.transport.crypto.CipherRegistry}. Key material is supplied out
 * of band in configuration; there is no handshake.
 */
package express.mvp.cipherlink.transport.crypto;
