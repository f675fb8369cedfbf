package express.mvp.cipherlink.transport.crypto;

import java.security.GeneralSecurityException;
import java.security.spec.AlgorithmParameterSpec;
import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;

/**
 * Key handling shared by the AES variants.
 *
 * <p>The key and the IV or nonce are fixed for the lifetime of the plugin. A new {@link Cipher}
 * is obtained for every operation, which keeps instances free of shared mutable state.
 */
abstract class AbstractAesCipher implements CipherPlugin {

    /** AES block size in bytes. */
    static final int BLOCK_SIZE = 16;

    /** Accepted AES key lengths in bytes. */
    static final int[] KEY_LENGTHS = {16, 24, 32};

    private final SecretKeySpec key;
    private final String transformation;

    AbstractAesCipher(byte[] key, String transformation) {
        if (key.length != 16 && key.length != 24 && key.length != 32) {
            throw new IllegalArgumentException("AES key must be 16, 24 or 32 bytes: " + key.length);
        }
        this.key = new SecretKeySpec(key, "AES");
        this.transformation = transformation;
    }

    /**
     * Initializes a throwaway cipher so that a key the provider refuses is reported at
     * construction rather than on the first frame.
     */
    final void checkKeyAccepted() {
        newCipher(Cipher.ENCRYPT_MODE);
    }

    /** Returns the IV or nonce parameters for a new cipher. */
    abstract AlgorithmParameterSpec parameters();

    final Cipher newCipher(int mode) {
        try {
            Cipher cipher = Cipher.getInstance(transformation);
            cipher.init(mode, key, parameters());
            return cipher;
        } catch (GeneralSecurityException e) {
            throw new CryptoException(type() + " cipher initialization failed", e);
        }
    }
}
