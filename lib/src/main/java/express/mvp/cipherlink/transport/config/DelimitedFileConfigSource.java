package express.mvp.cipherlink.transport.config;

import express.mvp.cipherlink.transport.ConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConfigSource} loaded from a comma-delimited file.
 *
 * <p>The first line is the header {@code service_type,service_name,version,settings}. Every
 * following non-blank line holds one service. The first three columns are split on commas; the
 * settings column is the rest of the line, so the JSON inside it may contain commas freely:
 *
 * <pre>
 * service_type,service_name,version,settings
 * network,server,1.0,{"role": "server", "host": "localhost", "port": 5000, ...}
 * network,client,1.0,{"role": "client", "host": "localhost", "port": 5000, ...}
 * </pre>
 *
 * <p>The whole file is read and every settings column is checked to be a JSON object at load
 * time, so a broken file fails fast instead of at the first lookup.
 */
public final class DelimitedFileConfigSource implements ConfigSource {

    private static final Logger LOGGER =
            Logger.getLogger(DelimitedFileConfigSource.class.getName());

    /** Expected header line. */
    public static final String HEADER = "service_type,service_name,version,settings";

    private final InMemoryConfigSource entries;
    private final Path path;

    private DelimitedFileConfigSource(Path path, InMemoryConfigSource entries) {
        this.path = path;
        this.entries = entries;
    }

    /**
     * Loads a file.
     *
     * @param path the file to read
     * @return the loaded source
     * @throws ConfigurationException if the file cannot be read or a row is malformed
     */
    public static DelimitedFileConfigSource load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration file " + path, e);
        }
        return parse(path, lines);
    }

    static DelimitedFileConfigSource parse(Path path, List<String> lines) {
        if (lines.isEmpty() || !HEADER.equals(stripBom(lines.get(0)).trim())) {
            throw new ConfigurationException(
                    "Configuration file " + path + " must start with header: " + HEADER);
        }
        InMemoryConfigSource entries = new InMemoryConfigSource();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            String[] columns = line.split(",", 4);
            if (columns.length < 4) {
                throw new ConfigurationException(String.format(
                        "%s line %d: expected 4 columns, got %d", path, i + 1, columns.length));
            }
            String settings = columns[3].trim();
            try {
                JsonSettings.parseObject(settings);
            } catch (ConfigurationException e) {
                throw new ConfigurationException(
                        String.format("%s line %d: %s", path, i + 1, e.getMessage()), e);
            }
            entries.register(columns[0].trim(), columns[1].trim(), columns[2].trim(), settings);
        }
        LOGGER.log(Level.INFO, "Loaded {0} service configuration(s) from {1}",
                new Object[] {entries.size(), path});
        return new DelimitedFileConfigSource(path, entries);
    }

    @Override
    public Optional<String> lookup(String domain, String serviceName, String version) {
        return entries.lookup(domain, serviceName, version);
    }

    /**
     * Returns the number of services loaded.
     *
     * @return the row count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the file this source was loaded from.
     *
     * @return the path
     */
    public Path path() {
        return path;
    }

    private static String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
