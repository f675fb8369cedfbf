package express.mvp.cipherlink.transport.crypto;

import java.security.GeneralSecurityException;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;

/**
 * AES-CBC cipher with PKCS#7 padding and a fixed IV.
 *
 * <p>Parameters:
 *
 * <ul>
 *   <li>{@code key}: base64, 16, 24 or 32 bytes after decoding
 *   <li>{@code iv}: base64, 16 bytes after decoding
 * </ul>
 *
 * <h2>Padding</h2>
 *
 * <p>Encryption always appends {@code n} bytes of value {@code n}, {@code 1 <= n <= 16}, so a
 * plaintext that is already block aligned gains a full block. Decryption reads {@code n} from the
 * final byte and rejects values outside {@code [1, 16]} or padding bytes that disagree with it.
 * The padding is applied here rather than by the provider so that a bad pad surfaces as a {@link
 * CryptoException} with a precise message.
 */
public final class AesCbcCipher extends AbstractAesCipher {

    private static final Logger LOGGER = Logger.getLogger(AesCbcCipher.class.getName());

    private static final int IV_LENGTH = 16;

    private final byte[] iv;

    /**
     * Creates a cipher from configuration parameters.
     *
     * @param config the cipher configuration
     * @throws express.mvp.cipherlink.transport.ConfigurationException if {@code key} or {@code
     *     iv} is missing, not base64, or of the wrong length
     * @throws CryptoException if the provider rejects the key
     */
    public AesCbcCipher(CipherConfig config) {
        this(config.base64Param("key", KEY_LENGTHS), config.base64Param("iv", IV_LENGTH));
    }

    /**
     * Creates a cipher from raw key material.
     *
     * @param key the AES key, 16, 24 or 32 bytes
     * @param iv the 16-byte IV
     */
    public AesCbcCipher(byte[] key, byte[] iv) {
        super(key, "AES/CBC/NoPadding");
        if (iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("AES-CBC IV must be 16 bytes: " + iv.length);
        }
        this.iv = iv.clone();
        checkKeyAccepted();
        LOGGER.log(Level.FINE, "Initialized AES-CBC cipher with {0}-bit key", key.length * 8);
    }

    @Override
    AlgorithmParameterSpec parameters() {
        return new IvParameterSpec(iv);
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        int padLength = BLOCK_SIZE - (plaintext.length % BLOCK_SIZE);
        byte[] padded = Arrays.copyOf(plaintext, plaintext.length + padLength);
        Arrays.fill(padded, plaintext.length, padded.length, (byte) padLength);
        try {
            byte[] encrypted = newCipher(Cipher.ENCRYPT_MODE).doFinal(padded);
            LOGGER.log(Level.FINE, "Encrypted {0} bytes with AES-CBC", plaintext.length);
            return encrypted;
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-CBC encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        if (ciphertext.length == 0 || ciphertext.length % BLOCK_SIZE != 0) {
            throw new CryptoException(
                    "AES-CBC ciphertext length must be a positive multiple of 16: "
                            + ciphertext.length);
        }
        byte[] padded;
        try {
            padded = newCipher(Cipher.DECRYPT_MODE).doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-CBC decryption failed", e);
        }
        int padLength = padded[padded.length - 1] & 0xFF;
        if (padLength < 1 || padLength > BLOCK_SIZE) {
            throw new CryptoException("Invalid AES-CBC padding length: " + padLength);
        }
        for (int i = padded.length - padLength; i < padded.length; i++) {
            if ((padded[i] & 0xFF) != padLength) {
                throw new CryptoException("Inconsistent AES-CBC padding");
            }
        }
        byte[] plaintext = Arrays.copyOf(padded, padded.length - padLength);
        LOGGER.log(Level.FINE, "Decrypted {0} bytes with AES-CBC", plaintext.length);
        return plaintext;
    }

    @Override
    public CipherType type() {
        return CipherType.AES_CBC;
    }

    @Override
    public String toString() {
        return "AesCbcCipher";
    }
}
