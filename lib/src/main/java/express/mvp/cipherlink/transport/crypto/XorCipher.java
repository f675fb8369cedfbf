package express.mvp.cipherlink.transport.crypto;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-byte XOR cipher.
 *
 * <p>Every output byte is the input byte XOR the configured key byte, so {@link #encrypt} and
 * {@link #decrypt} are the same involution. Used for wiring tests; it provides no secrecy.
 *
 * <p>Parameters: {@code byte}, an integer in {@code [0, 255]}.
 */
public final class XorCipher implements CipherPlugin {

    private static final Logger LOGGER = Logger.getLogger(XorCipher.class.getName());

    private final byte key;

    /**
     * Creates a cipher from configuration parameters.
     *
     * @param config the cipher configuration
     * @throws express.mvp.cipherlink.transport.ConfigurationException if {@code byte} is missing
     *     or outside {@code [0, 255]}
     */
    public XorCipher(CipherConfig config) {
        this(config.intParam("byte", 0, 255));
    }

    /**
     * Creates a cipher with an explicit key byte.
     *
     * @param key the key, in {@code [0, 255]}
     * @throws IllegalArgumentException if the key is out of range
     */
    public XorCipher(int key) {
        if (key < 0 || key > 255) {
            throw new IllegalArgumentException("XOR key must be between 0 and 255: " + key);
        }
        this.key = (byte) key;
        LOGGER.log(Level.FINE, "Initialized XOR cipher with byte {0}", key);
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        return apply(plaintext);
    }

    @Override
    public byte[] decrypt(byte[] ciphertext) {
        return apply(ciphertext);
    }

    @Override
    public CipherType type() {
        return CipherType.XOR;
    }

    private byte[] apply(byte[] input) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (input[i] ^ key);
        }
        return output;
    }

    @Override
    public String toString() {
        return "XorCipher";
    }
}
