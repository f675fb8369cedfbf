package express.mvp.cipherlink.transport;

import java.net.Socket;
import java.util.Optional;

/**
 * Persistent listener of a server {@link Endpoint}.
 *
 * <p>Unlike {@link Endpoint#connect()}, which closes the listening socket once a peer is
 * admitted, an acceptor keeps listening and hands out admitted connections one after another:
 *
 * <pre>{@code
 * try (ConnectionAcceptor acceptor = endpoint.acceptor()) {
 *     Optional<Socket> next;
 *     while ((next = acceptor.next()).isPresent()) {
 *         executor.submit(() -> channel.serve(next.get()));
 *     }
 * }
 * }</pre>
 *
 * <p>Accept timeouts are retried internally and peers rejected by the security guard are closed
 * without being returned. {@link #next()} is meant for a single acceptor thread; {@link #close()}
 * may be called from any thread and makes a blocked {@code next()} return empty. Closing the
 * acceptor closes its endpoint.
 */
public final class ConnectionAcceptor implements AutoCloseable {

    private final Endpoint endpoint;

    ConnectionAcceptor(Endpoint endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * Blocks until the next admitted peer connects.
     *
     * @return the connected socket with the read timeout applied, or empty once closed
     * @throws TransportException if accepting fails for a reason other than closing
     */
    public Optional<Socket> next() {
        return endpoint.acceptNext();
    }

    /**
     * Returns the port the listener is bound to.
     *
     * @return the local port
     */
    public int localPort() {
        return endpoint.localPort();
    }

    /**
     * Checks if the listener is still open.
     *
     * @return true until {@link #close()} is called or accepting fails
     */
    public boolean isOpen() {
        return !endpoint.state().isTerminal();
    }

    /** Closes the listener and its endpoint. */
    @Override
    public void close() {
        endpoint.close();
    }

    @Override
    public String toString() {
        return "ConnectionAcceptor[" + endpoint + "]";
    }
}
