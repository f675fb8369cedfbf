package express.mvp.cipherlink.transport.lifecycle;

/**
 * Represents the states of an endpoint.
 *
 * <p>Server and client endpoints share one state set but walk different paths through it.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * Server:
 * ┌─────────┐  bind   ┌───────────┐ connect() ┌───────────┐ admitted ┌─────────────┐
 * │ UNBOUND │────────▶│ LISTENING │──────────▶│ ACCEPTING │─────────▶│ ESTABLISHED │
 * └─────────┘         └───────────┘           └───────────┘          └─────────────┘
 *                           ▲                    │  ▲  rejected peer        │
 *                           │                    └──┘  (stays)              │
 *                           └──────────────── next connect() ◀──────────────┘
 *
 * Client:
 * ┌─────────┐ connect() ┌────────────┐ success ┌─────────────┐
 * │ UNBOUND │──────────▶│ CONNECTING │────────▶│ ESTABLISHED │
 * └─────────┘           └────────────┘         └─────────────┘
 *
 * Any socket failure ──▶ FAILED ──▶ CLOSED      close() from any state ──▶ CLOSED
 * </pre>
 *
 * <p>{@link #FAILED} is terminal for I/O: a failed endpoint is never retried, only closed.
 *
 * @see EndpointStateMachine
 */
public enum EndpointState {

    /** Constructed, no socket yet. */
    UNBOUND("Unbound", false),

    /** Server socket bound and listening, nobody waiting in accept. */
    LISTENING("Listening", false),

    /** A caller is blocked in accept. Rejected peers do not leave this state. */
    ACCEPTING("Accepting", false),

    /** Client connect in progress. */
    CONNECTING("Connecting", false),

    /** A connected socket has been handed to the caller. */
    ESTABLISHED("Established", false),

    /** A bind, listen, accept or connect failed. Only {@link #CLOSED} may follow. */
    FAILED("Failed", true),

    /** Listener released. No transitions leave this state. */
    CLOSED("Closed", true);

    private final String displayName;
    private final boolean terminal;

    EndpointState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if the endpoint can no longer produce sockets.
     *
     * @return true for {@link #FAILED} and {@link #CLOSED}
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Checks if a server listening socket is open in this state.
     *
     * @return true for {@link #LISTENING} and {@link #ACCEPTING}
     */
    public boolean isListening() {
        return this == LISTENING || this == ACCEPTING;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
