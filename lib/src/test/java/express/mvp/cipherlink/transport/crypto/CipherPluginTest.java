package express.mvp.cipherlink.transport.crypto;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.cipherlink.transport.ConfigurationException;
import express.mvp.cipherlink.transport.config.InMemoryConfigSource;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Behaviour shared by every {@link CipherPlugin} variant.
 */
@DisplayName("CipherPlugin")
class CipherPluginTest {

    static final byte[] KEY_256 = sequence(32, 1);
    static final byte[] IV = sequence(16, 100);
    static final byte[] NONCE = sequence(12, 200);

    static Stream<CipherPlugin> allCiphers() {
        return Stream.of(
                new XorCipher(42),
                new AesCbcCipher(KEY_256, IV),
                new AesGcmCipher(KEY_256, NONCE),
                new AesCbcCipher(sequence(16, 7), IV),
                new AesGcmCipher(sequence(24, 9), NONCE));
    }

    static byte[] sequence(int length, int start) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (start + i);
        }
        return bytes;
    }

    // ==================== Round trip ====================

    @ParameterizedTest
    @MethodSource("allCiphers")
    @DisplayName("Empty plaintext round-trips")
    void emptyRoundTrip(CipherPlugin cipher) {
        assertArrayEquals(new byte[0], cipher.decrypt(cipher.encrypt(new byte[0])));
    }

    @ParameterizedTest
    @MethodSource("allCiphers")
    @DisplayName("Short text round-trips")
    void shortRoundTrip(CipherPlugin cipher) {
        byte[] plaintext = "Hello, Server!".getBytes(StandardCharsets.UTF_8);
        byte[] ciphertext = cipher.encrypt(plaintext);
        assertFalse(Arrays.equals(plaintext, ciphertext));
        assertArrayEquals(plaintext, cipher.decrypt(ciphertext));
    }

    @ParameterizedTest
    @MethodSource("allCiphers")
    @DisplayName("Multi-block random data round-trips")
    void multiBlockRoundTrip(CipherPlugin cipher) {
        byte[] plaintext = new byte[70_003];
        new Random(17).nextBytes(plaintext);
        assertArrayEquals(plaintext, cipher.decrypt(cipher.encrypt(plaintext)));
    }

    @ParameterizedTest
    @MethodSource("allCiphers")
    @DisplayName("Encryption is deterministic for a fixed key")
    void deterministic(CipherPlugin cipher) {
        byte[] plaintext = "same input".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(cipher.encrypt(plaintext), cipher.encrypt(plaintext));
    }

    @ParameterizedTest
    @MethodSource("allCiphers")
    @DisplayName("Input array is not modified")
    void inputUntouched(CipherPlugin cipher) {
        byte[] plaintext = "do not touch".getBytes(StandardCharsets.UTF_8);
        byte[] copy = plaintext.clone();
        cipher.encrypt(plaintext);
        assertArrayEquals(copy, plaintext);
    }

    // ==================== XOR ====================

    @Nested
    @DisplayName("XOR")
    class XorTests {

        @Test
        @DisplayName("Each byte is XORed with the key")
        void xorsEachByte() {
            XorCipher cipher = new XorCipher(42);
            assertArrayEquals(new byte[] {0x6B, 0x2A, (byte) 0xD5},
                    cipher.encrypt(new byte[] {0x41, 0x00, (byte) 0xFF}));
        }

        @Test
        @DisplayName("Encrypt equals decrypt")
        void involution() {
            XorCipher cipher = new XorCipher(0x5A);
            byte[] data = "involution".getBytes(StandardCharsets.UTF_8);
            assertArrayEquals(cipher.encrypt(data), cipher.decrypt(data));
            assertArrayEquals(data, cipher.encrypt(cipher.encrypt(data)));
        }

        @Test
        @DisplayName("Key 0 is the identity")
        void zeroKeyIdentity() {
            byte[] data = {1, 2, 3};
            assertArrayEquals(data, new XorCipher(0).encrypt(data));
        }

        @Test
        @DisplayName("Out-of-range key is rejected")
        void rejectsOutOfRangeKey() {
            assertThrows(IllegalArgumentException.class, () -> new XorCipher(256));
            assertThrows(IllegalArgumentException.class, () -> new XorCipher(-1));
        }

        @Test
        @DisplayName("Reports its type")
        void type() {
            assertEquals(CipherType.XOR, new XorCipher(1).type());
        }
    }

    // ==================== AES-CBC ====================

    @Nested
    @DisplayName("AES-CBC")
    class AesCbcTests {

        private final AesCbcCipher cipher = new AesCbcCipher(KEY_256, IV);

        @Test
        @DisplayName("Ciphertext is padded to the next full block")
        void padsToNextBlock() {
            assertEquals(16, cipher.encrypt(new byte[0]).length);
            assertEquals(16, cipher.encrypt(new byte[15]).length);
            assertEquals(32, cipher.encrypt(new byte[16]).length);
            assertEquals(32, cipher.encrypt(new byte[17]).length);
        }

        @Test
        @DisplayName("Empty ciphertext is rejected")
        void rejectsEmpty() {
            assertThrows(CryptoException.class, () -> cipher.decrypt(new byte[0]));
        }

        @Test
        @DisplayName("Ciphertext that is not a block multiple is rejected")
        void rejectsPartialBlock() {
            assertThrows(CryptoException.class, () -> cipher.decrypt(new byte[17]));
        }

        @Test
        @DisplayName("Encrypted block of bad padding is rejected")
        void rejectsBadPadding() throws Exception {
            // Encrypt a full block with no padding so its last byte (0x00) is an invalid count.
            Cipher raw = Cipher.getInstance("AES/CBC/NoPadding");
            raw.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(KEY_256, "AES"),
                    new IvParameterSpec(IV));
            byte[] zeroPad = raw.doFinal(new byte[16]);
            CryptoException e = assertThrows(CryptoException.class, () -> cipher.decrypt(zeroPad));
            assertTrue(e.getMessage().contains("padding"));

            byte[] block = new byte[16];
            block[15] = 3;
            block[14] = 3;
            block[13] = 9;
            byte[] inconsistent = raw.doFinal(block);
            assertThrows(CryptoException.class, () -> cipher.decrypt(inconsistent));
        }

        @Test
        @DisplayName("Invalid key and IV lengths are rejected")
        void rejectsBadLengths() {
            assertThrows(IllegalArgumentException.class, () -> new AesCbcCipher(new byte[15], IV));
            assertThrows(IllegalArgumentException.class,
                    () -> new AesCbcCipher(KEY_256, new byte[12]));
        }
    }

    // ==================== AES-GCM ====================

    @Nested
    @DisplayName("AES-GCM")
    class AesGcmTests {

        private final AesGcmCipher cipher = new AesGcmCipher(KEY_256, NONCE);

        @Test
        @DisplayName("Ciphertext carries a 16-byte tag")
        void appendsTag() {
            assertEquals(AesGcmCipher.TAG_LENGTH, cipher.encrypt(new byte[0]).length);
            assertEquals(5 + AesGcmCipher.TAG_LENGTH, cipher.encrypt(new byte[5]).length);
        }

        @Test
        @DisplayName("Every single-bit flip in ciphertext or tag is detected")
        void detectsEveryBitFlip() {
            byte[] ciphertext = cipher.encrypt("tamper".getBytes(StandardCharsets.UTF_8));
            for (int bit = 0; bit < ciphertext.length * 8; bit++) {
                byte[] tampered = ciphertext.clone();
                tampered[bit / 8] ^= (byte) (1 << (bit % 8));
                int flipped = bit;
                assertThrows(CryptoException.class, () -> cipher.decrypt(tampered),
                        () -> "bit " + flipped + " flip was not detected");
            }
        }

        @Test
        @DisplayName("Input shorter than the tag is rejected")
        void rejectsShortInput() {
            assertThrows(CryptoException.class, () -> cipher.decrypt(new byte[15]));
        }

        @Test
        @DisplayName("Ciphertext from another key fails authentication")
        void rejectsWrongKey() {
            AesGcmCipher other = new AesGcmCipher(sequence(32, 77), NONCE);
            byte[] ciphertext = other.encrypt(new byte[] {1, 2, 3});
            CryptoException e =
                    assertThrows(CryptoException.class, () -> cipher.decrypt(ciphertext));
            assertEquals("AES-GCM authentication failed", e.getMessage());
        }

        @Test
        @DisplayName("Invalid nonce length is rejected")
        void rejectsBadNonce() {
            assertThrows(IllegalArgumentException.class,
                    () -> new AesGcmCipher(KEY_256, new byte[16]));
        }
    }

    // ==================== Configuration ====================

    @Nested
    @DisplayName("Built from configuration")
    class FromConfigTests {

        private final Base64.Encoder base64 = Base64.getEncoder();

        @Test
        @DisplayName("XOR reads the byte parameter")
        void xorFromConfig() {
            CipherPlugin cipher = new XorCipher(CipherConfig.of("xor", Map.of("byte", 42)));
            assertArrayEquals(new XorCipher(42).encrypt(new byte[] {7}),
                    cipher.encrypt(new byte[] {7}));
        }

        @Test
        @DisplayName("AES-CBC reads base64 key and iv")
        void cbcFromConfig() {
            CipherPlugin cipher = new AesCbcCipher(CipherConfig.of("aes-cbc", Map.of(
                    "key", base64.encodeToString(KEY_256), "iv", base64.encodeToString(IV))));
            assertArrayEquals(new AesCbcCipher(KEY_256, IV).encrypt(new byte[] {7}),
                    cipher.encrypt(new byte[] {7}));
        }

        @Test
        @DisplayName("AES-GCM reads base64 key and nonce")
        void gcmFromConfig() {
            CipherPlugin cipher = new AesGcmCipher(CipherConfig.of("aes-gcm", Map.of(
                    "key", base64.encodeToString(KEY_256),
                    "nonce", base64.encodeToString(NONCE))));
            assertArrayEquals(new AesGcmCipher(KEY_256, NONCE).encrypt(new byte[] {7}),
                    cipher.encrypt(new byte[] {7}));
        }

        @Test
        @DisplayName("fromConfig reads the crypto section of a network service")
        void fromConfigSource() {
            InMemoryConfigSource source = new InMemoryConfigSource().registerNetwork(
                    "server", "1.0", "{\"settings\": {\"crypto\": {\"type\": \"AES-GCM\","
                            + " \"params\": {\"key\": \"" + base64.encodeToString(KEY_256)
                            + "\", \"nonce\": \"" + base64.encodeToString(NONCE) + "\"}}}}");

            CipherPlugin cipher = CipherPlugin.fromConfig(source, "server", "1.0");

            assertEquals(CipherType.AES_GCM, cipher.type());
            assertArrayEquals(new byte[] {7}, new AesGcmCipher(KEY_256, NONCE)
                    .decrypt(cipher.encrypt(new byte[] {7})));
        }

        @Test
        @DisplayName("fromConfig fails for an unknown service")
        void fromConfigMissing() {
            assertThrows(ConfigurationException.class,
                    () -> CipherPlugin.fromConfig(new InMemoryConfigSource(), "server", "1.0"));
        }
    }
}
