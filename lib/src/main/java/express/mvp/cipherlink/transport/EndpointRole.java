package express.mvp.cipherlink.transport;

import java.util.Locale;

/** Which side of a connection an {@link Endpoint} plays. */
public enum EndpointRole {

    /** Initiates a connection to a listening server. */
    CLIENT("client"),

    /** Binds, listens and accepts admitted peers. */
    SERVER("server");

    private final String configName;

    EndpointRole(String configName) {
        this.configName = configName;
    }

    /**
     * Returns the name used for this role in settings documents.
     *
     * @return {@code "client"} or {@code "server"}
     */
    public String configName() {
        return configName;
    }

    /**
     * Parses a role name, ignoring case and surrounding whitespace.
     *
     * @param value the role name from configuration
     * @return the role
     * @throws ConfigurationException if the value is null or names no role
     */
    public static EndpointRole fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (EndpointRole role : values()) {
                if (role.configName.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new ConfigurationException(
                "Invalid role: " + value + " (expected 'client' or 'server')");
    }
}
