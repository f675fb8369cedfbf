package express.mvp.cipherlink.transport;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for connection workers and acceptor threads.
 *
 * <p>Creates platform threads named {@code {prefix}-{counter}}. A connection worker spends
 * nearly all of its time blocked in a socket read, so one thread per connection is the
 * intended use:
 *
 * <pre>{@code
 * WorkerThreadFactory factory = new WorkerThreadFactory("cipherlink-worker");
 * ExecutorService executor = Executors.newCachedThreadPool(factory);
 * executor.submit(() -> channel.serve(socket));
 * }</pre>
 *
 * <p>Uncaught exceptions are logged at {@code SEVERE} instead of being printed to stderr.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class WorkerThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(WorkerThreadFactory.class.getName());

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    /** Base name prefix for created threads. */
    private final String namePrefix;

    /** Whether created threads should be daemon threads. */
    private final boolean daemon;

    /**
     * Creates a factory producing daemon threads.
     *
     * @param namePrefix the prefix for thread names
     */
    public WorkerThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public WorkerThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    /**
     * Creates a new, unstarted thread for the given runnable.
     *
     * @param runnable the task to execute
     * @return a new platform thread (not started)
     */
    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler((t, e) ->
                LOGGER.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "WorkerThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
