package express.mvp.cipherlink.transport.lifecycle;

/**
 * Callback for endpoint state changes.
 *
 * <p>Listeners run synchronously on the thread that performed the transition, which is often an
 * acceptor thread. They should return quickly. An exception thrown by a listener is logged and
 * does not affect the transition or other listeners.
 *
 * @see EndpointStateMachine#addListener(EndpointStateListener)
 */
@FunctionalInterface
public interface EndpointStateListener {

    /**
     * Called after a successful transition.
     *
     * @param previous the state before the transition
     * @param current the state after the transition
     * @param cause the failure behind the transition, or null
     */
    void onStateChanged(EndpointState previous, EndpointState current, Throwable cause);
}
