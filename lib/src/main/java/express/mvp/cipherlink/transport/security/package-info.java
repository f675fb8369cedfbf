/** Per-source connection and data rate limiting, payload validation and socket timeouts. */
package express.mvp.cipherlink.transport.security;
