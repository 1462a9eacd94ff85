package workerkit.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory that creates daemon threads, either sequentially numbered or explicitly named.
 *
 * <p>{@link #newThread(Runnable)} names threads {@code <prefix>1}, {@code <prefix>2}, etc.
 * {@link #newNamedThread(Runnable, String)} names them {@code <prefix><name>} so that a
 * thread dump shows which worker a thread belongs to. All threads are daemon threads so they
 * do not prevent JVM shutdown.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        return newNamedThread(runnable, Integer.toString(counter.getAndIncrement()));
    }

    /**
     * Creates an unstarted daemon thread with the given name suffix.
     *
     * @param runnable the thread body
     * @param name     suffix appended to the prefix
     * @return the new thread
     */
    public Thread newNamedThread(Runnable runnable, String name) {
        Objects.requireNonNull(name, "name");
        Thread thread = new Thread(runnable, prefix + name);
        thread.setDaemon(true);
        return thread;
    }
}
