package express.mvp.cipherlink.transport.crypto;

import java.security.GeneralSecurityException;
import java.security.spec.AlgorithmParameterSpec;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

/**
 * AES-GCM authenticated cipher with a fixed nonce.
 *
 * <p>Parameters:
 *
 * <ul>
 *   <li>{@code key}: base64, 16, 24 or 32 bytes after decoding
 *   <li>{@code nonce}: base64, 12 bytes after decoding
 * </ul>
 *
 * <p>Output layout is {@code ciphertext || tag} with a 16-byte tag. Any modification of either
 * part makes {@link #decrypt(byte[])} fail with a {@link CryptoException}; no plaintext is
 * released before the tag verifies.
 *
 * <p>The nonce does not change between messages. Both peers must agree on it without a
 * handshake, so the same key and nonce protect every frame of every session configured with
 * them.
 */
public final class AesGcmCipher extends AbstractAesCipher {

    private static final Logger LOGGER = Logger.getLogger(AesGcmCipher.class.getName());

    /** Length of the authentication tag appended to every ciphertext. */
    public static final int TAG_LENGTH = 16;

    private static final int NONCE_LENGTH = 12;

    private final byte[] nonce;

    /**
     * Creates a cipher from configuration parameters.
     *
     * @param config the cipher configuration
     * @throws express.mvp.cipherlink.transport.ConfigurationException if {@code key} or {@code
     *     nonce} is missing, not base64, or of the wrong length
     * @throws CryptoException if the provider rejects the key
     */
    public AesGcmCipher(CipherConfig config) {
        this(config.base64Param("key", KEY_LENGTHS), config.base64Param("nonce", NONCE_LENGTH));
    }

    /**
     * Creates a cipher from raw key material.
     *
     * @param key the AES key, 16, 24 or 32 bytes
     * @param nonce the 12-byte nonce
     */
    public AesGcmCipher(byte[] key, byte[] nonce) {
        super(key, "AES/GCM/NoPadding");
        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("AES-GCM nonce must be 12 bytes: " + nonce.length);
        }
        this.nonce = nonce.clone();
        checkKeyAccepted();
        LOGGER.log(Level.FINE, "Initialized AES-GCM cipher with {0}-bit key", key.length * 8);
    }

    @Override
    AlgorithmParameterSpec parameters() {
        return new GCMParameterSpec(TAG_LENGTH * 8, nonce);
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        try {
            byte[] sealed = newCipher(Cipher.ENCRYPT_MODE).doFinal(plaintext);
            LOGGER.log(Level.FINE, "Encrypted {0} bytes with AES-GCM", plaintext.length);
            return sealed;
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-GCM encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        if (ciphertext.length < TAG_LENGTH) {
            throw new CryptoException(
                    "AES-GCM ciphertext shorter than the authentication tag: "
                            + ciphertext.length);
        }
        try {
            byte[] plaintext = newCipher(Cipher.DECRYPT_MODE).doFinal(ciphertext);
            LOGGER.log(Level.FINE, "Decrypted {0} bytes with AES-GCM", plaintext.length);
            return plaintext;
        } catch (AEADBadTagException e) {
            throw new CryptoException("AES-GCM authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-GCM decryption failed", e);
        }
    }

    @Override
    public CipherType type() {
        return CipherType.AES_GCM;
    }

    @Override
    public String toString() {
        return "AesGcmCipher";
    }
}
