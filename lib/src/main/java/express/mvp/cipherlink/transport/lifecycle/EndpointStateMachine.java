package express.mvp.cipherlink.transport.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the endpoint lifecycle.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * UNBOUND     → LISTENING, CONNECTING, FAILED, CLOSED
 * LISTENING   → ACCEPTING, FAILED, CLOSED
 * ACCEPTING   → ESTABLISHED, LISTENING, FAILED, CLOSED
 * CONNECTING  → ESTABLISHED, FAILED, CLOSED
 * ESTABLISHED → LISTENING, CONNECTING, FAILED, CLOSED
 * FAILED      → CLOSED
 * CLOSED      → (terminal, no transitions)
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointStateMachine state = new EndpointStateMachine("server:1.0");
 * state.addListener((prev, curr, cause) ->
 *     LOGGER.fine(() -> prev + " -> " + curr));
 *
 * state.transitionTo(EndpointState.LISTENING);
 * state.transitionTo(EndpointState.ACCEPTING);
 * state.transitionTo(EndpointState.ESTABLISHED);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Transitions are compare-and-set operations, so two threads
 * racing to close and fail an endpoint see exactly one winner per transition.
 *
 * @see EndpointState
 * @see EndpointStateListener
 */
public final class EndpointStateMachine {

    private static final Logger LOGGER = Logger.getLogger(EndpointStateMachine.class.getName());

    private static final Set<EndpointState> FROM_UNBOUND = EnumSet.of(
            EndpointState.LISTENING, EndpointState.CONNECTING,
            EndpointState.FAILED, EndpointState.CLOSED);

    private static final Set<EndpointState> FROM_LISTENING = EnumSet.of(
            EndpointState.ACCEPTING, EndpointState.FAILED, EndpointState.CLOSED);

    private static final Set<EndpointState> FROM_ACCEPTING = EnumSet.of(
            EndpointState.ESTABLISHED, EndpointState.LISTENING,
            EndpointState.FAILED, EndpointState.CLOSED);

    private static final Set<EndpointState> FROM_CONNECTING = EnumSet.of(
            EndpointState.ESTABLISHED, EndpointState.FAILED, EndpointState.CLOSED);

    private static final Set<EndpointState> FROM_ESTABLISHED = EnumSet.of(
            EndpointState.LISTENING, EndpointState.CONNECTING,
            EndpointState.FAILED, EndpointState.CLOSED);

    private static final Set<EndpointState> FROM_FAILED = EnumSet.of(EndpointState.CLOSED);

    private final AtomicReference<EndpointState> state =
            new AtomicReference<>(EndpointState.UNBOUND);

    private final List<EndpointStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Identifier used in log messages, typically {@code serviceName:version}. */
    private final String endpointId;

    /**
     * Creates a new state machine in {@link EndpointState#UNBOUND}.
     *
     * @param endpointId identifier for log messages
     */
    public EndpointStateMachine(String endpointId) {
        this.endpointId = endpointId;
    }

    /**
     * Returns the current state.
     *
     * @return the current endpoint state
     */
    public EndpointState getState() {
        return state.get();
    }

    /**
     * Returns the endpoint identifier.
     *
     * @return the identifier
     */
    public String getEndpointId() {
        return endpointId;
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(EndpointStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(EndpointStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired new state
     * @return true if the transition was successful
     */
    public boolean transitionTo(EndpointState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * @param newState the desired new state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was successful
     */
    public boolean transitionTo(EndpointState newState, Throwable cause) {
        while (true) {
            EndpointState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return true;
            }
            // CAS failed, retry with new current state
        }
    }

    /**
     * Attempts to transition from a specific expected state.
     *
     * @param expectedState the expected current state
     * @param newState the desired new state
     * @return true if transition successful, false if current state doesn't match
     */
    public boolean transitionFrom(EndpointState expectedState, EndpointState newState) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            notifyListeners(expectedState, newState, null);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(EndpointState from, EndpointState to) {
        if (from == to) {
            return false; // No self-transitions
        }
        return getValidTransitions(from).contains(to);
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return set of valid target states
     */
    public static Set<EndpointState> getValidTransitions(EndpointState from) {
        return switch (from) {
            case UNBOUND -> EnumSet.copyOf(FROM_UNBOUND);
            case LISTENING -> EnumSet.copyOf(FROM_LISTENING);
            case ACCEPTING -> EnumSet.copyOf(FROM_ACCEPTING);
            case CONNECTING -> EnumSet.copyOf(FROM_CONNECTING);
            case ESTABLISHED -> EnumSet.copyOf(FROM_ESTABLISHED);
            case FAILED -> EnumSet.copyOf(FROM_FAILED);
            case CLOSED -> EnumSet.noneOf(EndpointState.class);
        };
    }

    private void notifyListeners(EndpointState previous, EndpointState current, Throwable cause) {
        LOGGER.log(Level.FINE, "Endpoint {0}: {1} -> {2}",
                new Object[] {endpointId, previous, current});
        for (EndpointStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Endpoint state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "EndpointStateMachine[" + endpointId + ":" + state.get() + "]";
    }
}
