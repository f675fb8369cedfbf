package express.mvp.cipherlink.transport.crypto;

import express.mvp.cipherlink.transport.ConfigurationException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable cipher selection: a {@link CipherType} plus its parameter map.
 *
 * <p>Parameter values are whatever the JSON settings carried: strings for base64 key material,
 * numbers for the XOR byte. The typed accessors below perform the validation that every plugin
 * constructor relies on, and raise {@link ConfigurationException} naming the offending key.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CipherConfig config = CipherConfig.of(CipherType.AES_GCM, Map.of(
 *     "key", "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=",
 *     "nonce", "bm9uY2UtMTJieXRl"));
 * CipherPlugin plugin = CipherRegistry.defaultRegistry().create(config);
 * }</pre>
 */
public final class CipherConfig {

    private final CipherType type;
    private final Map<String, Object> params;

    private CipherConfig(CipherType type, Map<String, Object> params) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Creates a configuration.
     *
     * @param type the cipher variant
     * @param params the variant's parameters
     * @return a new immutable configuration
     */
    public static CipherConfig of(CipherType type, Map<String, ?> params) {
        Objects.requireNonNull(params, "params must not be null");
        return new CipherConfig(type, new LinkedHashMap<>(params));
    }

    /**
     * Creates a configuration from a type tag as it appears in settings.
     *
     * @param tag the type tag, e.g. {@code "xor"}
     * @param params the variant's parameters
     * @return a new immutable configuration
     * @throws ConfigurationException if the tag is unknown
     */
    public static CipherConfig of(String tag, Map<String, ?> params) {
        return of(CipherType.fromTag(tag), params);
    }

    /**
     * Returns the cipher variant.
     *
     * @return the type
     */
    public CipherType type() {
        return type;
    }

    /**
     * Returns the raw parameter map.
     *
     * @return an unmodifiable view of the parameters
     */
    public Map<String, Object> params() {
        return params;
    }

    /**
     * Reads an integral parameter constrained to {@code [min, max]}.
     *
     * @param name the parameter name
     * @param min the smallest accepted value
     * @param max the largest accepted value
     * @return the value
     * @throws ConfigurationException if missing, not an integer, or out of range
     */
    public int intParam(String name, int min, int max) {
        Object value = params.get(name);
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte)) {
            throw new ConfigurationException(String.format(
                    "%s parameter '%s' must be an integer between %d and %d, got: %s",
                    type, name, min, max, value));
        }
        long number = ((Number) value).longValue();
        if (number < min || number > max) {
            throw new ConfigurationException(String.format(
                    "%s parameter '%s' must be between %d and %d, got: %d",
                    type, name, min, max, number));
        }
        return (int) number;
    }

    /**
     * Reads a base64 parameter and checks the decoded length.
     *
     * @param name the parameter name
     * @param allowedLengths the accepted decoded lengths in bytes
     * @return the decoded bytes
     * @throws ConfigurationException if missing, not a string, not valid base64, or of a length
     *     outside {@code allowedLengths}
     */
    public byte[] base64Param(String name, int... allowedLengths) {
        Object value = params.get(name);
        if (!(value instanceof String)) {
            throw new ConfigurationException(String.format(
                    "%s parameter '%s' must be a base64 string", type, name));
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(((String) value).trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format(
                    "%s parameter '%s' is not valid base64", type, name), e);
        }
        for (int allowed : allowedLengths) {
            if (decoded.length == allowed) {
                return decoded;
            }
        }
        throw new ConfigurationException(String.format(
                "%s parameter '%s' has invalid length %d", type, name, decoded.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CipherConfig)) {
            return false;
        }
        CipherConfig that = (CipherConfig) o;
        return type == that.type && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, params);
    }

    /** Parameter values are key material and are deliberately left out. */
    @Override
    public String toString() {
        return "CipherConfig[type=" + type + ", params=" + params.keySet() + "]";
    }
}
