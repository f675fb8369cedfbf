package express.mvp.cipherlink.transport.security;

import express.mvp.cipherlink.transport.TransportException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-source-IP sliding-window {@link SecurityGuard}.
 *
 * <p>For every distinct source IP the guard keeps the timestamps of admitted connections and the
 * sizes of admitted data chunks. A new event is evaluated against what remains after events older
 * than {@link SecurityPolicy#windowSeconds()} have been dropped:
 *
 * <ul>
 *   <li>a connection is rejected once the window already holds {@code maxConnectionsPerWindow}
 *       connections
 *   <li>a data chunk is rejected if it would push the window's byte total above {@code
 *       maxBytesPerWindow}
 * </ul>
 *
 * <p>Rejected events are not recorded.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Per-IP state lives in a {@link ConcurrentHashMap} and each entry is locked on its own, so a
 * burst from one address never blocks admission decisions for another. Entries are created on
 * first sight of an IP and kept for the lifetime of the guard.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SecurityGuard guard = new SlidingWindowSecurityGuard(SecurityPolicy.builder()
 *     .maxConnectionsPerWindow(5)
 *     .windowSeconds(30)
 *     .build());
 *
 * if (!guard.admitConnection(peer.getHostAddress())) {
 *     socket.close();
 * }
 * }</pre>
 */
public final class SlidingWindowSecurityGuard implements SecurityGuard {

    private static final Logger LOGGER =
            Logger.getLogger(SlidingWindowSecurityGuard.class.getName());

    private final SecurityPolicy policy;
    private final Clock clock;
    private final long windowMs;
    private final ConcurrentMap<String, RateState> states = new ConcurrentHashMap<>();

    /**
     * Creates a guard that reads time from the system clock.
     *
     * @param policy the limits to enforce
     */
    public SlidingWindowSecurityGuard(SecurityPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    /**
     * Creates a guard with an explicit clock.
     *
     * @param policy the limits to enforce
     * @param clock the time source for window calculations
     */
    public SlidingWindowSecurityGuard(SecurityPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windowMs = policy.window().toMillis();
        LOGGER.log(Level.FINE, "Initialized security guard with {0}", policy);
    }

    @Override
    public boolean admitConnection(String sourceIp) {
        RateState state = stateFor(sourceIp);
        boolean admitted =
                state.tryAdmitConnection(clock.millis(), windowMs, policy.maxConnectionsPerWindow());
        if (admitted) {
            LOGGER.log(Level.FINE, "Admitted connection from {0} ({1}/{2} in {3}s)",
                    new Object[] {sourceIp, state.connectionCount(),
                            policy.maxConnectionsPerWindow(), policy.windowSeconds()});
        } else {
            LOGGER.log(Level.WARNING, "Connection rate limit exceeded for {0}: {1} in {2}s",
                    new Object[] {sourceIp, policy.maxConnectionsPerWindow(),
                            policy.windowSeconds()});
        }
        return admitted;
    }

    @Override
    public boolean admitData(String sourceIp, long byteCount) {
        if (byteCount < 0) {
            throw new IllegalArgumentException("byteCount must not be negative: " + byteCount);
        }
        RateState state = stateFor(sourceIp);
        boolean admitted = state.tryAdmitData(
                clock.millis(), windowMs, byteCount, policy.maxBytesPerWindow());
        if (admitted) {
            LOGGER.log(Level.FINE, "Admitted {0} bytes from {1} ({2}/{3} in {4}s)",
                    new Object[] {byteCount, sourceIp, state.bytesInWindow(),
                            policy.maxBytesPerWindow(), policy.windowSeconds()});
        } else {
            LOGGER.log(Level.WARNING, "Data rate limit exceeded for {0}: {1} more bytes in {2}s",
                    new Object[] {sourceIp, byteCount, policy.windowSeconds()});
        }
        return admitted;
    }

    @Override
    public boolean validatePayload(byte[] data) {
        if (data == null || data.length == 0) {
            LOGGER.warning("Empty payload rejected");
            return false;
        }
        return validatePayloadLength(data.length);
    }

    @Override
    public boolean validatePayloadLength(long length) {
        if (length <= 0) {
            LOGGER.warning("Empty payload rejected");
            return false;
        }
        if (length > policy.maxBytesPerWindow()) {
            LOGGER.log(Level.WARNING, "Payload size {0} exceeds maximum allowed {1}",
                    new Object[] {length, policy.maxBytesPerWindow()});
            return false;
        }
        return true;
    }

    @Override
    public void applyTimeout(Socket socket) {
        try {
            socket.setSoTimeout(timeoutMillis());
        } catch (SocketException e) {
            throw new TransportException(
                    "Failed to set socket timeout", e);
        }
        LOGGER.log(Level.FINE, "Set socket timeout to {0}s", policy.socketTimeoutSeconds());
    }

    @Override
    public void applyTimeout(ServerSocket serverSocket) {
        try {
            serverSocket.setSoTimeout(timeoutMillis());
        } catch (SocketException e) {
            throw new TransportException(
                    "Failed to set accept timeout", e);
        }
        LOGGER.log(Level.FINE, "Set accept timeout to {0}s", policy.socketTimeoutSeconds());
    }

    @Override
    public SecurityPolicy policy() {
        return policy;
    }

    /**
     * Returns the number of distinct source IPs seen so far.
     *
     * @return the tracked source count
     */
    public int trackedSources() {
        return states.size();
    }

    private RateState stateFor(String sourceIp) {
        Objects.requireNonNull(sourceIp, "sourceIp must not be null");
        return states.computeIfAbsent(sourceIp, ip -> new RateState());
    }

    private int timeoutMillis() {
        return Math.toIntExact(policy.socketTimeout().toMillis());
    }

    @Override
    public String toString() {
        return "SlidingWindowSecurityGuard[" + policy + ", sources=" + states.size() + "]";
    }
}
