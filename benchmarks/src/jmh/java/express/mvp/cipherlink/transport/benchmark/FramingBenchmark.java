package express.mvp.cipherlink.transport.benchmark;

import express.mvp.cipherlink.transport.framing.FramingHandler;
import express.mvp.cipherlink.transport.framing.LengthPrefixedFramingHandler;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
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

/** Frame encode/decode cost on arrays and streams. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 3, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class FramingBenchmark {

    @Param({"16", "2048", "70000"})
    private int payloadSize;

    private final FramingHandler framing = new LengthPrefixedFramingHandler();
    private byte[] payload;
    private byte[] frame;
    private byte[] destination;

    @Setup
    public void setup() {
        payload = new byte[payloadSize];
        frame = framing.frameMessage(payload);
        destination = new byte[payloadSize];
    }

    @Benchmark
    public byte[] frameMessage() {
        return framing.frameMessage(payload);
    }

    @Benchmark
    public int deframeMessage() {
        return framing.deframeMessage(frame, frame.length, destination);
    }

    @Benchmark
    public byte[] streamRoundTrip() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(frame.length);
        framing.writeFrame(out, payload);
        return framing.readFrame(new ByteArrayInputStream(out.toByteArray()));
    }
}
