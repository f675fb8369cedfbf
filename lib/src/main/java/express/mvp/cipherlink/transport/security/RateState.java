package express.mvp.cipherlink.transport.security;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Sliding-window counters for one source IP.
 *
 * <p>Holds the timestamps of admitted connections and the {@code (timestamp, bytes)} pairs of
 * admitted data, both in arrival order. Entries older than the window are dropped at the start of
 * every check. Each instance is its own monitor, so checks for one IP are serialized while other
 * IPs proceed independently.
 */
final class RateState {

    private final ArrayDeque<Long> connectionTimestamps = new ArrayDeque<>();
    private final ArrayDeque<long[]> dataEvents = new ArrayDeque<>();

    /** Running sum of the byte counts held in {@link #dataEvents}. */
    private long bytesInWindow;

    synchronized boolean tryAdmitConnection(long nowMs, long windowMs, int maxConnections) {
        while (!connectionTimestamps.isEmpty()
                && nowMs - connectionTimestamps.peekFirst() > windowMs) {
            connectionTimestamps.pollFirst();
        }
        if (connectionTimestamps.size() >= maxConnections) {
            return false;
        }
        connectionTimestamps.addLast(nowMs);
        return true;
    }

    synchronized boolean tryAdmitData(long nowMs, long windowMs, long byteCount, long maxBytes) {
        Iterator<long[]> it = dataEvents.iterator();
        while (it.hasNext()) {
            long[] event = it.next();
            if (nowMs - event[0] <= windowMs) {
                break;
            }
            bytesInWindow -= event[1];
            it.remove();
        }
        if (bytesInWindow + byteCount > maxBytes) {
            return false;
        }
        dataEvents.addLast(new long[] {nowMs, byteCount});
        bytesInWindow += byteCount;
        return true;
    }

    synchronized int connectionCount() {
        return connectionTimestamps.size();
    }

    synchronized long bytesInWindow() {
        return bytesInWindow;
    }
}
