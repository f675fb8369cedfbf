package express.mvp.cipherlink.transport;

import express.mvp.cipherlink.transport.config.ConfigSource;
import express.mvp.cipherlink.transport.config.ServiceSettings;
import express.mvp.cipherlink.transport.lifecycle.EndpointState;
import express.mvp.cipherlink.transport.lifecycle.EndpointStateListener;
import express.mvp.cipherlink.transport.lifecycle.EndpointStateMachine;
import express.mvp.cipherlink.transport.security.SecurityGuard;
import express.mvp.cipherlink.transport.security.SlidingWindowSecurityGuard;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A role-bound TCP endpoint that produces connected sockets.
 *
 * <p>An endpoint is created from an {@link EndpointConfig}, usually resolved from a
 * {@link ConfigSource} with {@link #fromConfig(ConfigSource, String, String)}. Its role decides
 * what {@link #connect()} does:
 *
 * <h2>Server</h2>
 *
 * <p>The listening socket is bound at construction ({@code SO_REUSEADDR}, accept timeout from
 * the security policy). {@code connect()} blocks until a peer passes
 * {@link SecurityGuard#admitConnection(String)}; accept timeouts are retried and rejected peers
 * are closed at once. The admitted socket gets the read timeout, the listening socket is closed
 * and the socket is returned. The next {@code connect()} binds the same port again, so a port of
 * {@code 0} resolves once and stays stable. For a listener that stays open use
 * {@link #acceptor()}.
 *
 * <h2>Client</h2>
 *
 * <p>{@code connect()} opens a socket to the configured host and port, using the socket timeout
 * as both connect and read timeout. Each call produces its own socket, so several threads may
 * connect at once; the state reports {@link EndpointState#CONNECTING} while the first of them is
 * in progress and {@link EndpointState#ESTABLISHED} once any has succeeded.
 *
 * <h2>Failures</h2>
 *
 * <p>A bind, accept or connect failure closes the socket involved, moves the endpoint to
 * {@link EndpointState#FAILED} and throws {@link TransportException}. A failed endpoint is never
 * retried; create a new one.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Endpoint server = Endpoint.fromConfig(source, "server", "1.0");
 * try (Socket socket = server.connect()) {
 *     ...
 * } finally {
 *     server.close();
 * }
 * }</pre>
 *
 * @see SecureChannel
 * @see EndpointStateMachine
 */
public final class Endpoint implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Endpoint.class.getName());

    /** Listen backlog for server endpoints. */
    public static final int BACKLOG = 50;

    private final EndpointConfig config;
    private final SecurityGuard securityGuard;
    private final EndpointStateMachine stateMachine;
    private final Object lock = new Object();

    /** Open listener, or null between single-shot accepts. Guarded by {@link #lock}. */
    private ServerSocket serverSocket;

    /** Port resolved by the first bind, or the configured port for clients. */
    private volatile int boundPort;

    /** Set once {@link #acceptor()} has been called. Guarded by {@link #lock}. */
    private boolean acceptorActive;

    /**
     * Creates an endpoint with a {@link SlidingWindowSecurityGuard} built from the configured
     * policy.
     *
     * @param config the endpoint configuration
     * @throws TransportException if a server endpoint cannot bind
     */
    public Endpoint(EndpointConfig config) {
        this(config, new SlidingWindowSecurityGuard(config.securityPolicy()));
    }

    /**
     * Creates an endpoint with the given security guard.
     *
     * @param config the endpoint configuration
     * @param securityGuard the guard deciding admission and timeouts
     * @throws TransportException if a server endpoint cannot bind
     */
    public Endpoint(EndpointConfig config, SecurityGuard securityGuard) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.securityGuard = Objects.requireNonNull(securityGuard, "securityGuard must not be null");
        this.stateMachine = new EndpointStateMachine(
                config.role().configName() + "@" + config.host() + ":" + config.port());
        this.boundPort = config.port();
        if (config.role() == EndpointRole.SERVER) {
            synchronized (lock) {
                serverSocket = openListener(config.port());
                boundPort = serverSocket.getLocalPort();
            }
            stateMachine.transitionTo(EndpointState.LISTENING);
            LOGGER.log(Level.INFO, "Server endpoint listening on {0}:{1}",
                    new Object[] {config.host(), String.valueOf(boundPort)});
        }
    }

    /**
     * Creates an endpoint from the settings of a network service.
     *
     * @param source the configuration source
     * @param serviceName the service name
     * @param version the configuration version
     * @return the endpoint, already listening if its role is server
     * @throws ConfigurationException if the settings are missing or invalid
     * @throws TransportException if a server endpoint cannot bind
     */
    public static Endpoint fromConfig(ConfigSource source, String serviceName, String version) {
        return new Endpoint(ServiceSettings.load(source, serviceName, version).endpointConfig());
    }

    /**
     * Produces one connected socket according to the role.
     *
     * @return a connected socket with the read timeout applied
     * @throws TransportException if binding, accepting or connecting fails
     * @throws IllegalStateException if the endpoint is closed or failed, or a server endpoint
     *     has handed its listener to an {@link #acceptor()}
     */
    public Socket connect() {
        return config.role() == EndpointRole.SERVER ? acceptOnce() : connectToServer();
    }

    /**
     * Returns a persistent listener for this server endpoint.
     *
     * <p>After this call {@link #connect()} is no longer available; the acceptor owns the
     * listening socket until it is closed.
     *
     * @return the acceptor
     * @throws IllegalStateException if this is a client endpoint or it is closed or failed
     */
    public ConnectionAcceptor acceptor() {
        if (config.role() != EndpointRole.SERVER) {
            throw new IllegalStateException("Only server endpoints can accept connections");
        }
        synchronized (lock) {
            checkUsable();
            acceptorActive = true;
        }
        return new ConnectionAcceptor(this);
    }

    Optional<Socket> acceptNext() {
        ServerSocket listener;
        synchronized (lock) {
            if (stateMachine.getState().isTerminal()) {
                return Optional.empty();
            }
            listener = ensureListener();
        }
        stateMachine.transitionFrom(EndpointState.ESTABLISHED, EndpointState.LISTENING);
        stateMachine.transitionTo(EndpointState.ACCEPTING);
        Socket peer = acceptAdmitted(listener);
        if (peer == null) {
            return Optional.empty();
        }
        stateMachine.transitionTo(EndpointState.ESTABLISHED);
        return Optional.of(peer);
    }

    private Socket acceptOnce() {
        ServerSocket listener;
        synchronized (lock) {
            checkUsable();
            if (acceptorActive) {
                throw new IllegalStateException("Listener is owned by a ConnectionAcceptor");
            }
            listener = ensureListener();
        }
        stateMachine.transitionFrom(EndpointState.ESTABLISHED, EndpointState.LISTENING);
        stateMachine.transitionTo(EndpointState.ACCEPTING);
        Socket peer = acceptAdmitted(listener);
        if (peer == null) {
            throw new TransportException("Endpoint closed while accepting on port " + boundPort);
        }
        synchronized (lock) {
            if (serverSocket == listener) {
                serverSocket = null;
            }
        }
        Sockets.closeQuietly(listener);
        stateMachine.transitionTo(EndpointState.ESTABLISHED);
        return peer;
    }

    /** Returns the open listener, binding the resolved port again if needed. Holds lock. */
    private ServerSocket ensureListener() {
        if (serverSocket == null) {
            serverSocket = openListener(boundPort);
            LOGGER.log(Level.FINE, "Re-bound listener on port {0}", String.valueOf(boundPort));
        }
        return serverSocket;
    }

    private ServerSocket openListener(int port) {
        ServerSocket listener = null;
        try {
            listener = new ServerSocket();
            listener.setReuseAddress(true);
            securityGuard.applyTimeout(listener);
            listener.bind(new InetSocketAddress(config.host(), port), BACKLOG);
            return listener;
        } catch (IOException | RuntimeException e) {
            Sockets.closeQuietly(listener);
            stateMachine.transitionTo(EndpointState.FAILED, e);
            throw new TransportException(
                    "Failed to bind " + config.host() + ":" + port, e);
        }
    }

    /**
     * Accepts until a peer is admitted. Returns null if the listener was closed meanwhile.
     */
    private Socket acceptAdmitted(ServerSocket listener) {
        while (true) {
            Socket peer;
            try {
                peer = listener.accept();
            } catch (SocketTimeoutException e) {
                if (listener.isClosed()) {
                    return null;
                }
                continue;
            } catch (IOException e) {
                if (listener.isClosed()) {
                    return null;
                }
                Sockets.closeQuietly(listener);
                stateMachine.transitionTo(EndpointState.FAILED, e);
                throw new TransportException("Accept failed on port " + boundPort, e);
            }

            String sourceIp = Sockets.peerAddress(peer);
            if (!securityGuard.admitConnection(sourceIp)) {
                Sockets.closeQuietly(peer);
                continue;
            }
            try {
                securityGuard.applyTimeout(peer);
            } catch (TransportException e) {
                LOGGER.log(Level.FINE, "Dropping peer " + sourceIp + ": " + e.getMessage(), e);
                Sockets.closeQuietly(peer);
                continue;
            }
            LOGGER.log(Level.FINE, "Accepted connection from {0}", sourceIp);
            return peer;
        }
    }

    private Socket connectToServer() {
        synchronized (lock) {
            checkUsable();
        }
        // Connects are independent; only the first of overlapping ones moves the state.
        stateMachine.transitionTo(EndpointState.CONNECTING);
        Socket socket = new Socket();
        try {
            securityGuard.applyTimeout(socket);
            socket.connect(new InetSocketAddress(config.host(), config.port()),
                    Math.toIntExact(securityGuard.policy().socketTimeout().toMillis()));
        } catch (IOException | RuntimeException e) {
            Sockets.closeQuietly(socket);
            stateMachine.transitionTo(EndpointState.FAILED, e);
            throw new TransportException(
                    "Failed to connect to " + config.host() + ":" + config.port(), e);
        }
        stateMachine.transitionTo(EndpointState.ESTABLISHED);
        LOGGER.log(Level.FINE, "Connected to {0}:{1}",
                new Object[] {config.host(), String.valueOf(config.port())});
        return socket;
    }

    private void checkUsable() {
        EndpointState current = stateMachine.getState();
        if (current.isTerminal()) {
            throw new IllegalStateException("Endpoint is " + current);
        }
    }

    /**
     * Returns the local port of a server endpoint, or the remote port of a client endpoint.
     *
     * @return the port; for servers configured with port 0 this is the resolved ephemeral port
     */
    public int localPort() {
        return boundPort;
    }

    public EndpointState state() {
        return stateMachine.getState();
    }

    public EndpointRole role() {
        return config.role();
    }

    public EndpointConfig config() {
        return config;
    }

    public SecurityGuard securityGuard() {
        return securityGuard;
    }

    /**
     * Registers a listener for lifecycle transitions.
     *
     * @param listener the listener
     */
    public void addStateListener(EndpointStateListener listener) {
        stateMachine.addListener(listener);
    }

    /**
     * Releases the listening socket. Sockets already handed out are not affected. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            Sockets.closeQuietly(serverSocket);
            serverSocket = null;
        }
        if (stateMachine.transitionTo(EndpointState.CLOSED)) {
            LOGGER.log(Level.INFO, "Endpoint {0} closed", stateMachine.getEndpointId());
        }
    }

    @Override
    public String toString() {
        return "Endpoint[" + config.role() + " " + config.host() + ":" + boundPort
                + ", state=" + stateMachine.getState() + "]";
    }
}
