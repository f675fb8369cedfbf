package express.mvp.cipherlink.transport;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.cipherlink.transport.config.InMemoryConfigSource;
import express.mvp.cipherlink.transport.lifecycle.EndpointState;
import express.mvp.cipherlink.transport.security.SecurityPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * Unit tests for {@link Endpoint} and {@link ConnectionAcceptor} over loopback sockets.
 */
@Timeout(30)
class EndpointTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        endpoints.forEach(Endpoint::close);
        executor.shutdownNow();
    }

    private Endpoint server(SecurityPolicy policy) {
        return track(new Endpoint(EndpointConfig.builder()
                .role(EndpointRole.SERVER)
                .host("127.0.0.1")
                .port(0)
                .securityPolicy(policy)
                .build()));
    }

    private Endpoint client(int port) {
        return track(new Endpoint(EndpointConfig.builder()
                .role(EndpointRole.CLIENT)
                .host("127.0.0.1")
                .port(port)
                .securityPolicy(SecurityPolicy.builder().socketTimeoutSeconds(2).build())
                .build()));
    }

    private Endpoint track(Endpoint endpoint) {
        endpoints.add(endpoint);
        return endpoint;
    }

    private static void awaitState(Endpoint endpoint, EndpointState state)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (endpoint.state() != state) {
            if (System.nanoTime() > deadline) {
                fail("Endpoint never reached " + state + ", still " + endpoint.state());
            }
            Thread.sleep(10);
        }
    }

    private static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    /** Asserts that the remote side closed the connection without sending anything. */
    private static void assertClosedByPeer(Socket socket) throws IOException {
        socket.setSoTimeout(5000);
        InputStream in = socket.getInputStream();
        try {
            assertEquals(-1, in.read());
        } catch (SocketException e) {
            // reset instead of FIN is also a close
        }
    }

    // ==================== Server Tests ====================

    @Nested
    @DisplayName("Server endpoint")
    class Server {

        @Test
        @DisplayName("Binds at construction and resolves port 0")
        void bindsOnConstruction() {
            Endpoint server = server(SecurityPolicy.defaults());

            assertEquals(EndpointState.LISTENING, server.state());
            assertEquals(EndpointRole.SERVER, server.role());
            assertTrue(server.localPort() > 0);
            assertEquals(0, server.config().port());
        }

        @Test
        @DisplayName("connect() accepts one peer and re-binds the same port for the next")
        void acceptsSingleConnection() throws Exception {
            Endpoint server = server(SecurityPolicy.defaults());
            int port = server.localPort();

            Future<Socket> accepted = executor.submit(server::connect);
            try (Socket first = client(port).connect();
                    Socket peer = accepted.get(5, TimeUnit.SECONDS)) {
                assertTrue(first.isConnected());
                assertEquals(first.getLocalPort(), peer.getPort());
                assertEquals(EndpointState.ESTABLISHED, server.state());
            }

            Future<Socket> second = executor.submit(server::connect);
            try (Socket again = client(port).connect();
                    Socket peer = second.get(5, TimeUnit.SECONDS)) {
                assertEquals(port, server.localPort());
                assertEquals(again.getLocalPort(), peer.getPort());
            }
        }

        @Test
        @DisplayName("Peers over the connection limit are closed and accepting continues")
        void rejectsFloodingPeer() throws Exception {
            Endpoint server = server(SecurityPolicy.builder().maxConnectionsPerWindow(1).build());
            ConnectionAcceptor acceptor = server.acceptor();

            Future<Optional<Socket>> first = executor.submit(acceptor::next);
            Socket admitted = client(server.localPort()).connect();
            Socket peer = first.get(5, TimeUnit.SECONDS).orElseThrow();

            Future<Optional<Socket>> second = executor.submit(acceptor::next);
            try (Socket rejected = client(server.localPort()).connect()) {
                assertClosedByPeer(rejected);
            }
            assertFalse(second.isDone());

            acceptor.close();
            assertTrue(second.get(5, TimeUnit.SECONDS).isEmpty());
            assertFalse(acceptor.isOpen());
            assertEquals(EndpointState.CLOSED, server.state());
            admitted.close();
            peer.close();
        }

        @Test
        @DisplayName("Acceptor serves many peers from one listener")
        void acceptorLoop() throws Exception {
            Endpoint server = server(SecurityPolicy.defaults());
            ConnectionAcceptor acceptor = server.acceptor();
            assertEquals(server.localPort(), acceptor.localPort());

            for (int i = 0; i < 3; i++) {
                Future<Optional<Socket>> next = executor.submit(acceptor::next);
                try (Socket socket = client(server.localPort()).connect();
                        Socket peer = next.get(5, TimeUnit.SECONDS).orElseThrow()) {
                    assertEquals(socket.getLocalPort(), peer.getPort());
                }
            }
            assertTrue(acceptor.isOpen());
        }

        @Test
        @DisplayName("connect() is refused while an acceptor owns the listener")
        void connectWithAcceptor() {
            Endpoint server = server(SecurityPolicy.defaults());
            server.acceptor();
            assertThrows(IllegalStateException.class, server::connect);
        }

        @Test
        @DisplayName("Closing while accepting unblocks the caller")
        void closeWhileAccepting() throws Exception {
            Endpoint server = server(SecurityPolicy.builder().socketTimeoutSeconds(1).build());
            Future<Socket> accepted = executor.submit(server::connect);
            awaitState(server, EndpointState.ACCEPTING);

            server.close();

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> accepted.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransportException.class, e.getCause());
            assertEquals(EndpointState.CLOSED, server.state());
        }

        @Test
        @DisplayName("Binding a port already in use fails")
        void bindFailure() {
            Endpoint first = server(SecurityPolicy.defaults());
            EndpointConfig taken = first.config().withPort(first.localPort());
            assertThrows(TransportException.class, () -> new Endpoint(taken));
        }
    }

    // ==================== Client Tests ====================

    @Nested
    @DisplayName("Client endpoint")
    class Client {

        @Test
        @DisplayName("Client does not bind and cannot accept")
        void noListener() {
            Endpoint client = client(1);
            assertEquals(EndpointState.UNBOUND, client.state());
            assertThrows(IllegalStateException.class, client::acceptor);
        }

        @Test
        @DisplayName("Refused connection moves the endpoint to FAILED")
        void connectFailure() throws IOException {
            Endpoint client = client(unusedPort());
            List<EndpointState> seen = new CopyOnWriteArrayList<>();
            client.addStateListener((prev, cur, cause) -> seen.add(cur));

            TransportException e = assertThrows(TransportException.class, client::connect);

            assertInstanceOf(IOException.class, e.getCause());
            assertEquals(EndpointState.FAILED, client.state());
            assertEquals(List.of(EndpointState.CONNECTING, EndpointState.FAILED), seen);
            assertThrows(IllegalStateException.class, client::connect);
        }

        @Test
        @DisplayName("Refused connect with the largest socket timeout moves to FAILED")
        void largestTimeout() throws IOException {
            Endpoint client = track(new Endpoint(EndpointConfig.builder()
                    .role(EndpointRole.CLIENT)
                    .host("127.0.0.1")
                    .port(unusedPort())
                    .securityPolicy(SecurityPolicy.builder()
                            .socketTimeoutSeconds(SecurityPolicy.MAX_SOCKET_TIMEOUT_SECONDS)
                            .build())
                    .build()));

            TransportException e = assertThrows(TransportException.class, client::connect);

            assertInstanceOf(IOException.class, e.getCause());
            assertEquals(EndpointState.FAILED, client.state());
        }

        @Test
        @DisplayName("Overlapping connects from several threads all succeed")
        void concurrentConnects() throws Exception {
            int callers = 16;
            Endpoint server = server(SecurityPolicy.builder()
                    .maxConnectionsPerWindow(100)
                    .build());
            ConnectionAcceptor acceptor = server.acceptor();
            List<Socket> accepted = new CopyOnWriteArrayList<>();
            Future<?> accepting = executor.submit(() -> {
                for (int i = 0; i < callers; i++) {
                    acceptor.next().ifPresent(accepted::add);
                }
            });
            Endpoint client = client(server.localPort());

            CountDownLatch start = new CountDownLatch(1);
            List<Future<Socket>> sockets = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                sockets.add(executor.submit(() -> {
                    start.await();
                    return client.connect();
                }));
            }
            start.countDown();

            try {
                for (Future<Socket> socket : sockets) {
                    assertTrue(socket.get(10, TimeUnit.SECONDS).isConnected());
                }
                accepting.get(10, TimeUnit.SECONDS);
                assertEquals(callers, accepted.size());
                assertEquals(EndpointState.ESTABLISHED, client.state());
            } finally {
                for (Future<Socket> socket : sockets) {
                    if (socket.isDone() && !socket.isCancelled()) {
                        try {
                            socket.get().close();
                        } catch (ExecutionException ignored) {
                            // failed connects have nothing to close
                        }
                    }
                }
                for (Socket socket : accepted) {
                    socket.close();
                }
            }
        }

        @Test
        @DisplayName("Client may reconnect after an established connection")
        void reconnect() throws Exception {
            Endpoint server = server(SecurityPolicy.defaults());
            ConnectionAcceptor acceptor = server.acceptor();
            Endpoint client = client(server.localPort());

            for (int i = 0; i < 2; i++) {
                Future<Optional<Socket>> next = executor.submit(acceptor::next);
                try (Socket socket = client.connect();
                        Socket peer = next.get(5, TimeUnit.SECONDS).orElseThrow()) {
                    assertEquals(EndpointState.ESTABLISHED, client.state());
                    assertNotNull(peer);
                }
            }
        }
    }

    // ==================== Lifecycle Tests ====================

    @Test
    @DisplayName("close() is idempotent and final")
    void closeIsFinal() {
        Endpoint server = server(SecurityPolicy.defaults());
        server.close();
        server.close();

        assertEquals(EndpointState.CLOSED, server.state());
        assertThrows(IllegalStateException.class, server::connect);
        assertThrows(IllegalStateException.class, server::acceptor);
    }

    @Test
    @DisplayName("fromConfig builds the endpoint from network settings")
    void fromConfig() {
        InMemoryConfigSource source = new InMemoryConfigSource()
                .registerNetwork("server", "1.0", TestConfigs.server(TestConfigs.xor(42),
                        "{\"max_connections_per_window\": 4}"));

        Endpoint server = track(Endpoint.fromConfig(source, "server", "1.0"));

        assertEquals(EndpointRole.SERVER, server.role());
        assertEquals(4, server.securityGuard().policy().maxConnectionsPerWindow());
        assertTrue(server.toString().contains("state=Listening"));
    }
}
