package workerkit.spi;

import workerkit.Outcome;
import workerkit.Task;

import java.util.function.Consumer;

/**
 * Platform adapter that spawns share-nothing workers.
 *
 * <p>Each call to {@link #spawn} creates one worker that runs exactly one task and then
 * sends exactly one message back: {@link Outcome.Fulfilled} with the task's value or
 * {@link Outcome.Failed} with whatever it threw. Exceptions never escape the worker.
 *
 * @see workerkit.platform.ThreadWorkerPlatform
 * @see workerkit.platform.ExecutorWorkerPlatform
 */
public interface WorkerPlatform extends AutoCloseable {

    /**
     * Spawns a worker for {@code task}.
     *
     * @param name      worker name, unique among live workers of the caller
     * @param task      the task to run
     * @param onMessage receives the worker's single result message, from the worker's context
     * @param <T>       the task's result type
     * @return a handle for tearing the worker down
     * @throws java.util.concurrent.RejectedExecutionException if the platform cannot spawn
     */
    <T> WorkerHandle spawn(String name, Task<T> task, Consumer<Outcome<T>> onMessage);

    /**
     * Releases platform resources. Workers still running may be abandoned.
     */
    @Override
    default void close() {
    }
}
