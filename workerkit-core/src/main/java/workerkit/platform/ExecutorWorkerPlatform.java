package workerkit.platform;

import workerkit.Outcome;
import workerkit.Task;
import workerkit.spi.WorkerHandle;
import workerkit.spi.WorkerPlatform;
import workerkit.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker platform backed by an {@link ExecutorService}.
 *
 * <p>Workers are logical: each task gets its own handle and result message, but runs on a
 * pooled thread. With a fixed pool, tasks beyond the pool size wait in the executor's queue
 * while already counting as live workers. Terminating a worker cancels its future,
 * interrupting it if it is running.
 *
 * <p>This class is thread-safe. {@link #close()} shuts down the executor only when this
 * platform created it.
 */
public final class ExecutorWorkerPlatform implements WorkerPlatform {
    private static final Logger logger = Logger.getLogger(ExecutorWorkerPlatform.class.getName());

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final long shutdownTimeoutMs;

    /**
     * Creates a platform with its own fixed pool of daemon threads.
     *
     * @param poolSize number of pooled threads
     * @throws IllegalArgumentException if {@code poolSize <= 0}
     */
    public ExecutorWorkerPlatform(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0, got: " + poolSize);
        }
        this.executor = Executors.newFixedThreadPool(poolSize, new DaemonThreadFactory("workerkit-pool-"));
        this.ownsExecutor = true;
        this.shutdownTimeoutMs = 5000;
    }

    /**
     * Creates a platform over a caller-managed executor.
     *
     * @param executor the executor that runs tasks
     */
    public ExecutorWorkerPlatform(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = false;
        this.shutdownTimeoutMs = 0;
    }

    @Override
    public <T> WorkerHandle spawn(String name, Task<T> task, Consumer<Outcome<T>> onMessage) {
        PooledWorker<T> worker = new PooledWorker<>(name, task, onMessage);
        worker.future = executor.submit(worker);
        if (worker.finished.get()) {
            worker.future.cancel(false);
        }
        return worker;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Worker pool did not terminate within " + shutdownTimeoutMs + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class PooledWorker<T> implements Runnable, WorkerHandle {
        private final String name;
        private final Task<T> task;
        private final Consumer<Outcome<T>> onMessage;
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile Future<?> future;

        PooledWorker(String name, Task<T> task, Consumer<Outcome<T>> onMessage) {
            this.name = name;
            this.task = task;
            this.onMessage = onMessage;
        }

        @Override
        public void run() {
            Outcome<T> result;
            try {
                result = Outcome.fulfilled(task.call());
            } catch (Throwable t) {
                result = Outcome.failed(t);
            }
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            // Pooled threads are reused; never hand them back interrupted
            Thread.interrupted();
            try {
                onMessage.accept(result);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Result handler failed for worker " + name, e);
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void terminate() {
            if (finished.compareAndSet(false, true)) {
                Future<?> f = future;
                if (f != null) {
                    f.cancel(true);
                }
            }
        }
    }
}
