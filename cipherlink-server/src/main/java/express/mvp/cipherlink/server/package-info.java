/**
 * Long-running multi-client server for cipherlink.
 *
 * <p>{@link express.mvp.cipherlink.server.CipherLinkServer} keeps one listener open, admits peers
 * through the endpoint's security guard and serves each connection on its own worker thread.
 */
package express.mvp.cipherlink.server;
