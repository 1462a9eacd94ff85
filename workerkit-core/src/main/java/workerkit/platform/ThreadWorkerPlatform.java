package workerkit.platform;

import workerkit.Outcome;
import workerkit.Task;
import workerkit.spi.WorkerHandle;
import workerkit.spi.WorkerPlatform;
import workerkit.util.DaemonThreadFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker platform that gives every task its own fresh daemon thread.
 *
 * <p>The thread is named after the worker and exits once the task's single result message
 * has been handed to the dispatcher. Terminating a worker that has not yet delivered
 * interrupts its thread.
 *
 * <p>This class is thread-safe.
 */
public final class ThreadWorkerPlatform implements WorkerPlatform {
    private static final Logger logger = Logger.getLogger(ThreadWorkerPlatform.class.getName());

    private final DaemonThreadFactory threadFactory;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ThreadWorkerPlatform() {
        this("workerkit-");
    }

    /**
     * @param threadNamePrefix prefix prepended to each worker name to form its thread name
     */
    public ThreadWorkerPlatform(String threadNamePrefix) {
        this.threadFactory = new DaemonThreadFactory(threadNamePrefix);
    }

    @Override
    public <T> WorkerHandle spawn(String name, Task<T> task, Consumer<Outcome<T>> onMessage) {
        if (closed.get()) {
            throw new RejectedExecutionException("Platform is closed");
        }
        ThreadWorker<T> worker = new ThreadWorker<>(name, task, onMessage);
        Thread thread = threadFactory.newNamedThread(worker, name);
        worker.thread = thread;
        thread.start();
        return worker;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private static final class ThreadWorker<T> implements Runnable, WorkerHandle {
        private final String name;
        private final Task<T> task;
        private final Consumer<Outcome<T>> onMessage;
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile Thread thread;

        ThreadWorker(String name, Task<T> task, Consumer<Outcome<T>> onMessage) {
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
            // Clear a late interrupt so it does not leak into the dispatcher's callbacks
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
                Thread t = thread;
                if (t != null) {
                    t.interrupt();
                }
            }
        }
    }
}
