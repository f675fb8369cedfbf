/**
 * Message framing for the TCP byte stream.
 *
 * <ul>
 *   <li>{@link express.mvp.cipherlink.transport.framing.FramingHandler} - Strategy interface for
 *       framing/deframing
 *   <li>{@link express.mvp.cipherlink.transport.framing.LengthPrefixedFramingHandler} - 4-byte
 *       big-endian unsigned length prefix
 *   <li>{@link express.mvp.cipherlink.transport.framing.FramingException} - Truncated, negative
 *       or oversized frames
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FramingHandler framing = new LengthPrefixedFramingHandler();
 * framing.writeFrame(socket.getOutputStream(), ciphertext);
 *
 * byte[] frame = framing.readFrame(socket.getInputStream());
 * if (frame == null) {
 *     // peer closed at a frame boundary
 * }
 * }</pre>
 */
package express.mvp.cipherlink.transport.framing;
