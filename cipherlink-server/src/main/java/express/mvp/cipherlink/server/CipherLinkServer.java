package express.mvp.cipherlink.server;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.cipherlink.transport.ConfigurationException;
import express.mvp.cipherlink.transport.ConnectionAcceptor;
import express.mvp.cipherlink.transport.Endpoint;
import express.mvp.cipherlink.transport.EndpointRole;
import express.mvp.cipherlink.transport.SecureChannel;
import express.mvp.cipherlink.transport.WorkerThreadFactory;
import express.mvp.cipherlink.transport.config.DelimitedFileConfigSource;
import express.mvp.cipherlink.transport.error.ErrorCategory;
import express.mvp.cipherlink.transport.error.ErrorClassifier;
import java.io.IOException;
import java.net.Socket;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multi-client server running the secure channel's serve loop for every admitted peer.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌────────────────────────────────────────────────────────────┐
 * │                      CipherLinkServer                      │
 * ├────────────────────────────────────────────────────────────┤
 * │   ┌──────────────────────┐                                 │
 * │   │ cipherlink-acceptor  │  ConnectionAcceptor.next()      │
 * │   │  • retries timeouts  │  (rate-limited admission)       │
 * │   └──────────┬───────────┘                                 │
 * │              │ one task per admitted socket                │
 * │              ▼                                             │
 * │   ┌───────────────────────────────────────────────────┐    │
 * │   │ cipherlink-worker-N                               │    │
 * │   │  SecureChannel.serve(socket)                      │    │
 * │   │  read frame → decrypt → PayloadHandler → encrypt  │    │
 * │   └───────────────────────────────────────────────────┘    │
 * └────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CipherLinkServerConfig config = CipherLinkServerConfig.builder()
 *     .configSource(source)
 *     .serviceName("server")
 *     .build();
 *
 * try (CipherLinkServer server = new CipherLinkServer(config)) {
 *     server.start();
 *     server.awaitReady(5, TimeUnit.SECONDS);
 *     ...
 * }
 * }</pre>
 *
 * <h2>Error Handling</h2>
 *
 * <p>A connection that fails is logged at the level of its {@link ErrorCategory} and dropped;
 * the server keeps accepting. An accept failure ends the acceptor thread, since the endpoint is
 * then {@code FAILED}.
 *
 * @see CipherLinkServerConfig
 */
public class CipherLinkServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(CipherLinkServer.class.getName());

    /** Name of the accept loop thread. */
    public static final String ACCEPTOR_THREAD_NAME = "cipherlink-acceptor";

    private final CipherLinkServerConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final CountDownLatch readyLatch = new CountDownLatch(1);

    /** Sockets currently being served, closed on stop. */
    private final Set<Socket> openSockets = ConcurrentHashMap.newKeySet();

    private final AtomicLong connectionsAccepted = new AtomicLong();
    private final AtomicLong connectionsFailed = new AtomicLong();

    @SuppressFBWarnings(
            value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
            justification = "Written once in start() before the acceptor thread is started.")
    private volatile SecureChannel channel;

    private volatile ConnectionAcceptor acceptor;
    private volatile ExecutorService workers;
    private Thread acceptorThread;

    /**
     * Creates a server. Nothing is bound until {@link #start()}.
     *
     * @param config the server configuration
     */
    public CipherLinkServer(CipherLinkServerConfig config) {
        this.config = config;
    }

    /**
     * Binds the listener and starts the acceptor thread.
     *
     * <p>Binding happens on the calling thread, so configuration and bind failures are thrown
     * from here. Calling {@code start()} on a running server does nothing.
     *
     * @throws ConfigurationException if the settings are invalid or do not have the server role
     * @throws express.mvp.cipherlink.transport.TransportException if binding fails
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            SecureChannel opened = SecureChannel.open(config.getConfigSource(),
                    config.getServiceName(), config.getVersion(), config.getPayloadHandler());
            Endpoint endpoint = opened.endpoint().orElseThrow();
            if (endpoint.role() != EndpointRole.SERVER) {
                opened.close();
                throw new ConfigurationException("Service " + config.getServiceName() + "/"
                        + config.getVersion() + " is not configured with the server role");
            }
            channel = opened;
            acceptor = endpoint.acceptor();
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }

        WorkerThreadFactory factory = new WorkerThreadFactory("cipherlink-worker");
        workers = config.getWorkerThreads() > 0
                ? Executors.newFixedThreadPool(config.getWorkerThreads(), factory)
                : Executors.newCachedThreadPool(factory);

        acceptorThread = new Thread(this::acceptLoop, ACCEPTOR_THREAD_NAME);
        acceptorThread.start();
        LOGGER.log(Level.INFO, "CipherLink server {0}/{1} started on port {2} ({3})",
                new Object[] {config.getServiceName(), config.getVersion(),
                        String.valueOf(localPort()), channel.cipher().type()});
    }

    /**
     * Waits for the acceptor thread to start accepting.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit of the timeout argument
     * @return true if the server is ready, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        return readyLatch.await(timeout, unit);
    }

    private void acceptLoop() {
        readyLatch.countDown();
        try {
            while (running.get()) {
                Optional<Socket> next = acceptor.next();
                if (next.isEmpty()) {
                    break;
                }
                dispatch(next.get());
            }
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorClassifier.classify(e);
            LOGGER.log(Level.SEVERE, "Acceptor stopped: " + ErrorClassifier.describeError(e), e);
            if (category.stopsServer()) {
                running.set(false);
            }
        }
        LOGGER.log(Level.FINE, "Acceptor thread exiting");
    }

    private void dispatch(Socket socket) {
        connectionsAccepted.incrementAndGet();
        openSockets.add(socket);
        try {
            workers.execute(() -> serveConnection(socket));
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Worker pool rejected connection, closing", e);
            openSockets.remove(socket);
            closeSocket(socket);
        }
    }

    private void serveConnection(Socket socket) {
        try {
            channel.serve(socket);
        } catch (RuntimeException e) {
            connectionsFailed.incrementAndGet();
            ErrorCategory category = ErrorClassifier.classify(e);
            LOGGER.log(category.logLevel(), "Connection dropped: "
                    + ErrorClassifier.describeError(e));
        } finally {
            openSockets.remove(socket);
        }
    }

    /**
     * Stops accepting, closes open connections and waits for workers.
     *
     * <p>Waits up to {@link CipherLinkServerConfig#getShutdownTimeout()} for workers to finish.
     */
    public void stop() {
        if (!running.getAndSet(false) && channel == null) {
            return;
        }
        SecureChannel current = channel;
        if (current != null) {
            current.close();
        }
        Thread thread = acceptorThread;
        if (thread != null) {
            try {
                thread.join(config.getShutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (Socket socket : openSockets) {
            closeSocket(socket);
        }
        ExecutorService pool = workers;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(
                        config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    LOGGER.warning("Workers did not finish in time, interrupting");
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channel = null;
        LOGGER.log(Level.INFO, "CipherLink server stopped after {0} connection(s)",
                connectionsAccepted.get());
    }

    @Override
    public void close() {
        stop();
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close socket", e);
        }
    }

    /**
     * Returns the bound port.
     *
     * @return the listening port, or -1 if not started
     */
    public int localPort() {
        ConnectionAcceptor current = acceptor;
        return current == null ? -1 : current.localPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getConnectionsAccepted() {
        return connectionsAccepted.get();
    }

    public long getConnectionsFailed() {
        return connectionsFailed.get();
    }

    public int getActiveConnections() {
        return openSockets.size();
    }

    /**
     * Runs a server from a delimited configuration file until the JVM exits.
     *
     * <p>Usage: {@code CipherLinkServer <services.csv> [serviceName] [version]}
     *
     * @param args command line arguments
     * @throws InterruptedException if interrupted while running
     */
    public static void main(String[] args) throws InterruptedException {
        if (args.length < 1 || args.length > 3) {
            System.err.println("Usage: CipherLinkServer <services.csv> [serviceName] [version]");
            System.exit(2);
        }
        CipherLinkServerConfig.Builder builder = CipherLinkServerConfig.builder()
                .configSource(DelimitedFileConfigSource.load(Path.of(args[0])));
        if (args.length > 1) {
            builder.serviceName(args[1]);
        }
        if (args.length > 2) {
            builder.version(args[2]);
        }
        CipherLinkServer server = new CipherLinkServer(builder.build());
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "cipherlink-shutdown"));
        server.start();
        server.acceptorThread.join();
    }
}
