package express.mvp.cipherlink.transport.security;

import java.net.ServerSocket;
import java.net.Socket;

/**
 * Admission and validation decisions for inbound connections and data.
 *
 * <p>A guard is injected into an endpoint rather than shared as a process-wide singleton, so a
 * test can supply one driven by a fixed clock. Every method must be safe to call concurrently
 * from independent connection workers. Two admissions for the same source IP must be serialized
 * so that no event is counted twice or lost.
 *
 * <p>A {@code false} result is a silent rejection: the caller closes the connection or drops the
 * data without telling the peer why.
 *
 * @see SlidingWindowSecurityGuard
 */
public interface SecurityGuard {

    /**
     * Decides whether a new connection from a source IP is admissible and records it if so.
     *
     * @param sourceIp the peer address, e.g. {@code "127.0.0.1"}
     * @return true if the connection is admitted
     */
    boolean admitConnection(String sourceIp);

    /**
     * Decides whether a chunk of data from a source IP is admissible and records it if so.
     *
     * @param sourceIp the peer address
     * @param byteCount the size of the chunk
     * @return true if the data is admitted
     */
    boolean admitData(String sourceIp, long byteCount);

    /**
     * Validates a received payload: it must be non-empty and no larger than the single-message
     * ceiling.
     *
     * @param data the payload
     * @return true if the payload is acceptable
     */
    boolean validatePayload(byte[] data);

    /**
     * Applies {@link #validatePayload(byte[])}'s size rule to an announced length, before any
     * buffer is allocated for it.
     *
     * @param length the announced payload length
     * @return true if a payload of this length would be acceptable
     */
    boolean validatePayloadLength(long length);

    /**
     * Sets the read timeout on a connected socket.
     *
     * @param socket the socket
     */
    void applyTimeout(Socket socket);

    /**
     * Sets the accept timeout on a listening socket.
     *
     * @param serverSocket the listening socket
     */
    void applyTimeout(ServerSocket serverSocket);

    /**
     * Returns the policy this guard enforces.
     *
     * @return the policy
     */
    SecurityPolicy policy();
}
