package express.mvp.cipherlink.transport.benchmark;

import express.mvp.cipherlink.transport.crypto.CipherConfig;
import express.mvp.cipherlink.transport.crypto.CipherPlugin;
import express.mvp.cipherlink.transport.crypto.CipherRegistry;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
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
import org.openjdk.jmh.annotations.Warmup;

/**
 * Encrypt and decrypt throughput of each cipher plugin.
 *
 * <p>The AES plugins build a fresh JCE {@code Cipher} per call, so small payloads mostly measure
 * that setup cost.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 3, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class CipherBenchmark {

    @Param({"xor", "aes-cbc", "aes-gcm"})
    private String cipherType;

    @Param({"64", "2048", "65536"})
    private int payloadSize;

    private CipherPlugin cipher;
    private byte[] plaintext;
    private byte[] ciphertext;

    @Setup
    public void setup() {
        Base64.Encoder base64 = Base64.getEncoder();
        Map<String, Object> params = switch (cipherType) {
            case "xor" -> Map.of("byte", 42);
            case "aes-cbc" -> Map.of(
                    "key", base64.encodeToString(randomBytes(32)),
                    "iv", base64.encodeToString(randomBytes(16)));
            case "aes-gcm" -> Map.of(
                    "key", base64.encodeToString(randomBytes(32)),
                    "nonce", base64.encodeToString(randomBytes(12)));
            default -> throw new IllegalArgumentException("Unknown cipher: " + cipherType);
        };
        cipher = CipherRegistry.defaultRegistry().create(CipherConfig.of(cipherType, params));
        plaintext = randomBytes(payloadSize);
        ciphertext = cipher.encrypt(plaintext);
    }

    @Benchmark
    public byte[] encrypt() {
        return cipher.encrypt(plaintext);
    }

    @Benchmark
    public byte[] decrypt() {
        return cipher.decrypt(ciphertext);
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        ThreadLocalRandom.current().nextBytes(bytes);
        return bytes;
    }
}
