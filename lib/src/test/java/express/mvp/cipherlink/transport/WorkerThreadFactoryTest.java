package express.mvp.cipherlink.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link WorkerThreadFactory}.
 */
class WorkerThreadFactoryTest {

    @Test
    @DisplayName("Threads are named with prefix and sequence")
    void naming() {
        WorkerThreadFactory factory = new WorkerThreadFactory("worker");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertEquals("worker-1", first.getName());
        assertEquals("worker-2", second.getName());
        assertEquals(2, factory.getThreadCount());
        assertEquals("worker", factory.getNamePrefix());
    }

    @Test
    @DisplayName("Daemon flag follows the constructor")
    void daemon() {
        assertTrue(new WorkerThreadFactory("d").newThread(() -> {}).isDaemon());
        WorkerThreadFactory nonDaemon = new WorkerThreadFactory("n", false);
        assertFalse(nonDaemon.isDaemon());
        assertFalse(nonDaemon.newThread(() -> {}).isDaemon());
    }

    @Test
    @DisplayName("Threads carry an uncaught exception handler")
    void uncaughtHandler() throws InterruptedException {
        Thread thread = new WorkerThreadFactory("failing").newThread(() -> {
            throw new IllegalStateException("expected");
        });
        assertNotNull(thread.getUncaughtExceptionHandler());
        thread.start();
        thread.join(5000);
        assertFalse(thread.isAlive());
    }

    @Test
    @DisplayName("Executors run tasks on factory threads")
    void executorThreads() throws Exception {
        ExecutorService executor =
                Executors.newFixedThreadPool(2, new WorkerThreadFactory("pool"));
        try {
            Future<String> name = executor.submit(() -> Thread.currentThread().getName());
            assertTrue(name.get(5, TimeUnit.SECONDS).startsWith("pool-"));
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }
}
