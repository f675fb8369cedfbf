package express.mvp.cipherlink.transport.framing;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Strategy interface for message framing and deframing over a TCP byte stream.
 *
 * <p>TCP delivers a continuous byte stream without message boundaries. A framing handler encodes
 * those boundaries so that each encrypted payload can be recovered whole on the other side.
 *
 * <h2>Framing Process</h2>
 *
 * <pre>
 * Sender:                                    Receiver:
 * ┌──────────────┐                          ┌──────────────┐
 * │  Ciphertext  │                          │  Ciphertext  │
 * └──────────────┘                          └──────────────┘
 *        │                                         ▲
 *        ▼ writeFrame()                            │ readFrame()
 * ┌────┬──────────────┐    Network    ┌────┬──────────────┐
 * │Len │  Ciphertext  │  ─────────▶  │Len │  Ciphertext  │
 * └────┴──────────────┘               └────┴──────────────┘
 * </pre>
 *
 * <p>The stream operations are split into {@link #readLength(InputStream)} and {@link
 * #readPayload(InputStream, long)} so a caller can vet an announced length before any payload
 * buffer is allocated.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations must be stateless and immutable after construction. The same handler may be
 * shared by every connection.
 *
 * @see LengthPrefixedFramingHandler
 * @see FramingException
 */
public interface FramingHandler {

    /**
     * Frames a payload into a new array holding header and payload.
     *
     * @param payload the payload
     * @return the complete frame
     * @throws FramingException if the payload exceeds {@link #getMaxPayloadSize()}
     */
    byte[] frameMessage(byte[] payload);

    /**
     * Deframes a message by extracting the payload from a framed message.
     *
     * <h3>Return Values</h3>
     *
     * <ul>
     *   <li>{@code >= 0}: the payload length; the payload has been written to destination
     *   <li>{@code -1}: incomplete frame, more data is needed
     * </ul>
     *
     * @param source the buffer holding the framed message (header + payload)
     * @param sourceLength the number of valid bytes in the source
     * @param destination the buffer to copy the payload into
     * @return the payload length if deframing succeeded, or -1 if the frame is incomplete
     * @throws FramingException if the header announces an oversized payload
     * @throws IndexOutOfBoundsException if destination is too small for the payload
     */
    int deframeMessage(byte[] source, int sourceLength, byte[] destination);

    /**
     * Writes one frame to a stream and flushes it.
     *
     * @param out the stream
     * @param payload the payload
     * @throws IOException if the write fails
     * @throws FramingException if the payload exceeds {@link #getMaxPayloadSize()}
     */
    void writeFrame(OutputStream out, byte[] payload) throws IOException;

    /**
     * Reads a frame header.
     *
     * @param in the stream
     * @return the announced payload length, or -1 if the stream ended before the first header
     *     byte
     * @throws IOException if the read fails
     * @throws FramingException if the stream ended inside the header
     */
    long readLength(InputStream in) throws IOException;

    /**
     * Reads exactly {@code length} payload bytes.
     *
     * @param in the stream
     * @param length the length returned by {@link #readLength(InputStream)}
     * @return the payload
     * @throws IOException if the read fails
     * @throws FramingException if the length exceeds {@link #getMaxPayloadSize()} or the stream
     *     ended early
     */
    byte[] readPayload(InputStream in, long length) throws IOException;

    /**
     * Reads one complete frame.
     *
     * @param in the stream
     * @return the payload, or {@code null} if the stream ended cleanly before a new frame
     * @throws IOException if the read fails
     * @throws FramingException if the frame is oversized or truncated
     */
    default byte[] readFrame(InputStream in) throws IOException {
        long length = readLength(in);
        if (length < 0) {
            return null;
        }
        return readPayload(in, length);
    }

    /**
     * Returns the size of the framing header in bytes.
     *
     * @return the header size in bytes
     */
    int getHeaderSize();

    /**
     * Returns the maximum payload size that can be framed.
     *
     * @return the maximum payload size in bytes
     */
    int getMaxPayloadSize();
}
