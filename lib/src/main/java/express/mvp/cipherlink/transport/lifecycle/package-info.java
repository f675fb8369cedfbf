/**
 * Endpoint lifecycle states and the state machine enforcing them.
 *
 * @see express.mvp.cipherlink.transport.lifecycle.EndpointStateMachine
 */
package express.mvp.cipherlink.transport.lifecycle;
