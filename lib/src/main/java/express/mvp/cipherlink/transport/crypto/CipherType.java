package express.mvp.cipherlink.transport.crypto;

import express.mvp.cipherlink.transport.ConfigurationException;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of cipher variants a channel can be configured with.
 *
 * <p>Each constant carries the tag used in the {@code crypto.type} setting. The provider-qualified
 * names of older settings rows ({@code cryptography:aes-cbc}, {@code pycryptodome:aes-gcm}) are
 * accepted as aliases.
 */
public enum CipherType {

    /** Single-byte XOR. Obfuscation only, offers no confidentiality. */
    XOR("xor"),

    /** AES in CBC mode with PKCS#7 padding. */
    AES_CBC("aes-cbc", "cryptography:aes-cbc"),

    /** AES in GCM mode; authenticated. */
    AES_GCM("aes-gcm", "pycryptodome:aes-gcm");

    private final String tag;
    private final List<String> aliases;

    CipherType(String tag, String... aliases) {
        this.tag = tag;
        this.aliases = List.of(aliases);
    }

    /**
     * Returns the configuration tag for this variant.
     *
     * @return the tag, e.g. {@code "aes-gcm"}
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a configuration tag or alias, ignoring case and surrounding whitespace.
     *
     * @param tag the configured tag
     * @return the matching variant
     * @throws ConfigurationException if the tag is null or unknown
     */
    public static CipherType fromTag(String tag) {
        if (tag == null) {
            throw new ConfigurationException("Cipher type is missing");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (CipherType type : values()) {
            if (type.tag.equals(normalized) || type.aliases.contains(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported cipher type: " + tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
