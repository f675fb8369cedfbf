package express.mvp.cipherlink.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Socket helpers shared by {@link Endpoint} and {@link SecureChannel}. */
final class Sockets {

    private static final Logger LOGGER = Logger.getLogger(Sockets.class.getName());

    private Sockets() {}

    /** Closes a socket or listener, logging a failure at FINE. Null is ignored. */
    static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Close failed: " + e.getMessage(), e);
        }
    }

    /** Returns the textual peer address used as the rate-limit key. */
    static String peerAddress(Socket socket) {
        return socket.getInetAddress() == null
                ? "unknown"
                : socket.getInetAddress().getHostAddress();
    }
}
