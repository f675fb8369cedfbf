package express.mvp.cipherlink.transport.benchmark;

import express.mvp.cipherlink.transport.Endpoint;
import express.mvp.cipherlink.transport.EndpointConfig;
import express.mvp.cipherlink.transport.EndpointRole;
import express.mvp.cipherlink.transport.SecureChannel;
import express.mvp.cipherlink.transport.crypto.CipherConfig;
import express.mvp.cipherlink.transport.crypto.CipherPlugin;
import express.mvp.cipherlink.transport.crypto.CipherRegistry;
import express.mvp.cipherlink.transport.security.SecurityPolicy;
import java.io.IOException;
import java.net.Socket;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Round-trip latency of one encrypted request/response over loopback.
 *
 * <p>One persistent connection; the server side runs {@link SecureChannel#serve(Socket)} on a
 * background thread. The data limit is raised so the guard never throttles the benchmark.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 10, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class PingPongBenchmark {

    @Param({"xor", "aes-gcm"})
    private String cipherType;

    @Param({"256", "2048"})
    private int payloadSize;

    private Endpoint serverEndpoint;
    private Thread serverThread;
    private Socket clientSocket;
    private SecureChannel clientChannel;
    private byte[] payload;

    @Setup
    public void setup() throws Exception {
        SecurityPolicy policy = SecurityPolicy.builder()
                .maxBytesPerWindow(Long.MAX_VALUE / 2)
                .windowSeconds(1)
                .socketTimeoutSeconds(30)
                .build();
        CipherPlugin cipher = CipherRegistry.defaultRegistry().create(cipherConfig());

        serverEndpoint = new Endpoint(EndpointConfig.builder()
                .role(EndpointRole.SERVER).host("127.0.0.1").port(0)
                .securityPolicy(policy).build());
        SecureChannel serverChannel = new SecureChannel(serverEndpoint, cipher);
        serverThread = new Thread(
                () -> serverChannel.serve(serverEndpoint.connect()), "pingpong-server");
        serverThread.setDaemon(true);
        serverThread.start();

        Endpoint clientEndpoint = new Endpoint(EndpointConfig.builder()
                .role(EndpointRole.CLIENT).host("127.0.0.1").port(serverEndpoint.localPort())
                .securityPolicy(policy).build());
        clientSocket = clientEndpoint.connect();
        clientChannel = new SecureChannel(clientEndpoint, cipher);
        payload = new byte[payloadSize];
        payload[0] = 1;
    }

    private CipherConfig cipherConfig() {
        Base64.Encoder base64 = Base64.getEncoder();
        if ("xor".equals(cipherType)) {
            return CipherConfig.of(cipherType, Map.of("byte", 42));
        }
        return CipherConfig.of(cipherType, Map.of(
                "key", base64.encodeToString(new byte[32]),
                "nonce", base64.encodeToString(new byte[12])));
    }

    @TearDown
    public void tearDown() throws IOException, InterruptedException {
        clientSocket.close();
        serverThread.join(5000);
        serverEndpoint.close();
    }

    @Benchmark
    public byte[] pingPong() {
        return clientChannel.sendAndReceive(clientSocket, payload);
    }
}
