/**
 * Configuration lookup and parsing.
 *
 * <p>{@link express.mvp.cipherlink.transport.config.ConfigSource} is the only external
 * dependency of the transport. Documents are JSON, parsed with the Jackson streaming API into
 * {@link express.mvp.cipherlink.transport.config.ServiceSettings}.
 */
package express.mvp.cipherlink.transport.config;
