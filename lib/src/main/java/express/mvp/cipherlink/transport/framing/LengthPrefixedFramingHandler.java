package express.mvp.cipherlink.transport.framing;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A framing handler that uses a 4-byte big-endian length prefix.
 *
 * <p>Each frame is a 32-bit unsigned integer in network byte order giving the payload length,
 * followed by exactly that many payload bytes. There is no other header: no magic number, no
 * version byte and no cipher identifier.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌────────────────────────┬─────────────────────────────────────┐
 * │  Length (4 bytes, BE)  │         Ciphertext (N bytes)        │
 * └────────────────────────┴─────────────────────────────────────┘
 *           ▲                              ▲
 *           │                              │
 *     Network byte order            Variable length
 *     (unsigned)                    (0 to maxPayloadSize)
 * </pre>
 *
 * <h2>Configuration</h2>
 *
 * <p>The maximum payload size is fixed at construction. The default is 16 MB ({@value
 * #DEFAULT_MAX_PAYLOAD_SIZE} bytes). A length prefix above the maximum is rejected before any
 * allocation.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FramingHandler framing = new LengthPrefixedFramingHandler();
 *
 * framing.writeFrame(socket.getOutputStream(), ciphertext);
 *
 * byte[] reply = framing.readFrame(socket.getInputStream());
 * if (reply == null) {
 *     // peer closed the connection at a frame boundary
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @see FramingHandler
 * @see FramingException
 */
public final class LengthPrefixedFramingHandler implements FramingHandler {

    /** The size of the length prefix header in bytes. */
    public static final int HEADER_SIZE = 4;

    /** The default maximum payload size: 16 MB. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private final int maxPayloadSize;

    /**
     * Creates a new length-prefixed framing handler with the default maximum payload size.
     */
    public LengthPrefixedFramingHandler() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    /**
     * Creates a new length-prefixed framing handler with the specified maximum payload size.
     *
     * @param maxPayloadSize the maximum payload size in bytes
     * @throws IllegalArgumentException if maxPayloadSize is not positive or exceeds {@link
     *     Integer#MAX_VALUE} - {@link #HEADER_SIZE}
     */
    public LengthPrefixedFramingHandler(int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        // Ensure total frame size doesn't overflow
        if (maxPayloadSize > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxPayloadSize too large, would overflow frame size: " + maxPayloadSize);
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    @Override
    public byte[] frameMessage(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        checkPayloadSize(payload.length);
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    /**
     * {@inheritDoc}
     *
     * <p>This implementation reads the 4-byte big-endian length prefix to determine the payload
     * size, then copies the payload to the destination. Returns -1 if the source doesn't contain
     * enough bytes for the complete frame.
     */
    @Override
    public int deframeMessage(byte[] source, int sourceLength, byte[] destination) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");

        if (sourceLength < 0 || sourceLength > source.length) {
            throw new IllegalArgumentException("Invalid sourceLength: " + sourceLength);
        }
        if (sourceLength < HEADER_SIZE) {
            return -1; // Incomplete header
        }

        long payloadLength = decodeLength(source);
        checkAnnouncedLength(payloadLength);

        if (sourceLength < HEADER_SIZE + payloadLength) {
            return -1; // Incomplete payload
        }
        if (destination.length < payloadLength) {
            throw new IndexOutOfBoundsException(String.format(
                    "Destination capacity %d is insufficient for payload size %d",
                    destination.length, payloadLength));
        }
        System.arraycopy(source, HEADER_SIZE, destination, 0, (int) payloadLength);
        return (int) payloadLength;
    }

    @Override
    public void writeFrame(OutputStream out, byte[] payload) throws IOException {
        out.write(frameMessage(payload));
        out.flush();
    }

    @Override
    public long readLength(InputStream in) throws IOException {
        byte[] header = in.readNBytes(HEADER_SIZE);
        if (header.length == 0) {
            return -1;
        }
        if (header.length < HEADER_SIZE) {
            throw new FramingException(
                    "Stream ended inside frame header after " + header.length + " bytes");
        }
        return decodeLength(header);
    }

    @Override
    public byte[] readPayload(InputStream in, long length) throws IOException {
        checkAnnouncedLength(length);
        byte[] payload = in.readNBytes((int) length);
        if (payload.length < length) {
            throw new FramingException(String.format(
                    "Stream ended inside frame payload: expected %d bytes, got %d",
                    length, payload.length));
        }
        return payload;
    }

    /**
     * {@inheritDoc}
     *
     * @return 4 (the size of the 32-bit length prefix)
     */
    @Override
    public int getHeaderSize() {
        return HEADER_SIZE;
    }

    @Override
    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    private static long decodeLength(byte[] header) {
        return ByteBuffer.wrap(header, 0, HEADER_SIZE).getInt() & 0xFFFFFFFFL;
    }

    private void checkPayloadSize(int size) {
        if (size > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Payload size %d exceeds maximum allowed size %d", size, maxPayloadSize));
        }
    }

    private void checkAnnouncedLength(long length) {
        if (length < 0) {
            throw new FramingException("Invalid negative length prefix: " + length);
        }
        if (length > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Length prefix %d exceeds maximum allowed size %d", length, maxPayloadSize));
        }
    }

    /**
     * Returns a string representation of this framing handler.
     *
     * @return a string containing the handler type and configuration
     */
    @Override
    public String toString() {
        return String.format("LengthPrefixedFramingHandler[headerSize=%d, maxPayloadSize=%d]",
                HEADER_SIZE, maxPayloadSize);
    }
}
