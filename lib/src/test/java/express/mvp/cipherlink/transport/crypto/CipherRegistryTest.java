package express.mvp.cipherlink.transport.crypto;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.cipherlink.transport.ConfigurationException;
import java.util.Base64;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link CipherRegistry}, {@link CipherType} and {@link CipherConfig}.
 */
@DisplayName("CipherRegistry")
class CipherRegistryTest {

    private static final String KEY_32 = Base64.getEncoder().encodeToString(new byte[32]);
    private static final String IV_16 = Base64.getEncoder().encodeToString(new byte[16]);
    private static final String NONCE_12 = Base64.getEncoder().encodeToString(new byte[12]);

    @Nested
    @DisplayName("Type tags")
    class TypeTagTests {

        @ParameterizedTest
        @ValueSource(strings = {"xor", "XOR", " Xor "})
        @DisplayName("Tags are case-insensitive and trimmed")
        void caseInsensitive(String tag) {
            assertEquals(CipherType.XOR, CipherType.fromTag(tag));
        }

        @Test
        @DisplayName("Every type round-trips through its tag")
        void roundTrip() {
            for (CipherType type : CipherType.values()) {
                assertEquals(type, CipherType.fromTag(type.tag()));
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "rot13", "aes", "cryptography:aes-gcm", "pycryptodome:xor"})
        @DisplayName("Unknown tags are configuration errors")
        void unknownTag(String tag) {
            assertThrows(ConfigurationException.class, () -> CipherType.fromTag(tag));
        }

        @Test
        @DisplayName("Provider-qualified tags of older settings rows are aliases")
        void providerAliases() {
            assertEquals(CipherType.AES_CBC, CipherType.fromTag("cryptography:aes-cbc"));
            assertEquals(CipherType.AES_GCM, CipherType.fromTag(" PyCryptodome:AES-GCM "));
            assertEquals("aes-cbc", CipherType.fromTag("cryptography:aes-cbc").tag());
        }

        @Test
        @DisplayName("Null tag is a configuration error")
        void nullTag() {
            assertThrows(ConfigurationException.class, () -> CipherType.fromTag(null));
        }
    }

    @Nested
    @DisplayName("Default registry")
    class DefaultRegistryTests {

        private final CipherRegistry registry = CipherRegistry.defaultRegistry();

        @Test
        @DisplayName("Registers every cipher type")
        void registersAll() {
            assertEquals(EnumSet.allOf(CipherType.class), registry.registeredTypes());
        }

        @Test
        @DisplayName("Creates each variant")
        void createsEachVariant() {
            assertInstanceOf(XorCipher.class,
                    registry.create(CipherConfig.of("xor", Map.of("byte", 7))));
            assertInstanceOf(AesCbcCipher.class, registry.create(
                    CipherConfig.of("aes-cbc", Map.of("key", KEY_32, "iv", IV_16))));
            assertInstanceOf(AesGcmCipher.class, registry.create(
                    CipherConfig.of("aes-gcm", Map.of("key", KEY_32, "nonce", NONCE_12))));
        }
    }

    @Nested
    @DisplayName("Custom registry")
    class CustomRegistryTests {

        @Test
        @DisplayName("Unregistered type is a configuration error")
        void unregisteredType() {
            CipherRegistry registry = CipherRegistry.builder()
                    .register(CipherType.XOR, XorCipher::new)
                    .build();
            assertEquals(EnumSet.of(CipherType.XOR), registry.registeredTypes());
            assertThrows(ConfigurationException.class, () -> registry.create(
                    CipherConfig.of("aes-gcm", Map.of("key", KEY_32, "nonce", NONCE_12))));
        }

        @Test
        @DisplayName("Later registration replaces earlier one")
        void replaces() {
            CipherPlugin fixed = new XorCipher(1);
            CipherRegistry registry = CipherRegistry.builder()
                    .register(CipherType.XOR, XorCipher::new)
                    .register(CipherType.XOR, config -> fixed)
                    .build();
            assertSame(fixed, registry.create(CipherConfig.of("xor", Map.of("byte", 9))));
        }
    }

    @Nested
    @DisplayName("Parameter validation")
    class ParameterTests {

        @Test
        @DisplayName("Missing XOR byte")
        void missingByte() {
            assertThrows(ConfigurationException.class,
                    () -> new XorCipher(CipherConfig.of("xor", Map.of())));
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 256, 1000})
        @DisplayName("XOR byte out of range")
        void byteOutOfRange(int value) {
            assertThrows(ConfigurationException.class,
                    () -> new XorCipher(CipherConfig.of("xor", Map.of("byte", value))));
        }

        @Test
        @DisplayName("XOR byte of the wrong JSON type")
        void byteWrongType() {
            assertThrows(ConfigurationException.class,
                    () -> new XorCipher(CipherConfig.of("xor", Map.of("byte", "42"))));
            assertThrows(ConfigurationException.class,
                    () -> new XorCipher(CipherConfig.of("xor", Map.of("byte", 4.2))));
        }

        @Test
        @DisplayName("Key that is not base64")
        void notBase64() {
            assertThrows(ConfigurationException.class, () -> new AesCbcCipher(
                    CipherConfig.of("aes-cbc", Map.of("key", "not*base64!", "iv", IV_16))));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 8, 15, 17, 31, 33, 64})
        @DisplayName("Key of a length AES does not accept")
        void badKeyLength(int length) {
            String key = Base64.getEncoder().encodeToString(new byte[length]);
            assertThrows(ConfigurationException.class, () -> new AesGcmCipher(
                    CipherConfig.of("aes-gcm", Map.of("key", key, "nonce", NONCE_12))));
        }

        @Test
        @DisplayName("IV and nonce of the wrong length")
        void badIvAndNonce() {
            assertThrows(ConfigurationException.class, () -> new AesCbcCipher(
                    CipherConfig.of("aes-cbc", Map.of("key", KEY_32, "iv", NONCE_12))));
            assertThrows(ConfigurationException.class, () -> new AesGcmCipher(
                    CipherConfig.of("aes-gcm", Map.of("key", KEY_32, "nonce", IV_16))));
        }

        @Test
        @DisplayName("Missing nonce")
        void missingNonce() {
            assertThrows(ConfigurationException.class, () -> new AesGcmCipher(
                    CipherConfig.of("aes-gcm", Map.of("key", KEY_32))));
        }

        @Test
        @DisplayName("toString does not reveal key material")
        void toStringHidesValues() {
            CipherConfig config = CipherConfig.of("aes-cbc", Map.of("key", KEY_32, "iv", IV_16));
            assertFalse(config.toString().contains(KEY_32));
            assertTrue(config.toString().contains("key"));
        }

        @Test
        @DisplayName("Later changes to the source map are not seen")
        void paramsCopied() {
            Map<String, Object> params = new HashMap<>();
            params.put("byte", 1);
            CipherConfig config = CipherConfig.of(CipherType.XOR, params);
            params.put("byte", 2);
            assertEquals(1, config.intParam("byte", 0, 255));
            assertThrows(UnsupportedOperationException.class, () -> config.params().put("x", 1));
        }
    }
}
