package express.mvp.cipherlink.transport.crypto;

import express.mvp.cipherlink.transport.config.ConfigSource;
import express.mvp.cipherlink.transport.config.ServiceSettings;

/**
 * Symmetric encryption unit applied to every frame of a channel.
 *
 * <p>A plugin is constructed once from validated {@link CipherConfig} parameters and then used
 * for the lifetime of a channel. The cipher identity is never carried on the wire; both peers must
 * be configured with the same type and key material out of band.
 *
 * <h2>Variants</h2>
 *
 * <ul>
 *   <li>{@link XorCipher}: single-byte XOR, encrypt and decrypt are the same operation
 *   <li>{@link AesCbcCipher}: AES-CBC with PKCS#7 padding and a fixed IV
 *   <li>{@link AesGcmCipher}: AES-GCM with a fixed nonce, output is ciphertext followed by a
 *       16-byte tag
 * </ul>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations must be safe for concurrent use. The AES variants obtain a fresh {@code
 * javax.crypto.Cipher} per call, so one plugin may serve every worker of a server.
 *
 * @see CipherRegistry
 */
public interface CipherPlugin {

    /**
     * Encrypts a plaintext.
     *
     * @param plaintext the bytes to encrypt, possibly empty
     * @return the ciphertext
     * @throws CryptoException if the underlying cipher fails
     */
    byte[] encrypt(byte[] plaintext);

    /**
     * Decrypts a ciphertext produced by {@link #encrypt(byte[])} with the same parameters.
     *
     * @param ciphertext the bytes to decrypt
     * @return the plaintext
     * @throws CryptoException if the ciphertext is malformed, its padding is inconsistent, or
     *     authentication fails
     */
    byte[] decrypt(byte[] ciphertext);

    /**
     * Returns the variant implemented by this plugin.
     *
     * @return the cipher type
     */
    CipherType type();

    /**
     * Builds the plugin described by the {@code crypto} section of a service's settings.
     *
     * @param source the configuration lookup
     * @param serviceName the network service name, e.g. {@code "server"}
     * @param version the configuration version, e.g. {@code "1.0"}
     * @return a ready plugin
     * @throws express.mvp.cipherlink.transport.ConfigurationException if the settings are absent,
     *     malformed or carry no usable {@code crypto} section
     * @throws CryptoException if the key material is rejected by the JCE provider
     */
    static CipherPlugin fromConfig(ConfigSource source, String serviceName, String version) {
        ServiceSettings settings = ServiceSettings.load(source, serviceName, version);
        return CipherRegistry.defaultRegistry().create(settings.cipherConfig());
    }
}
