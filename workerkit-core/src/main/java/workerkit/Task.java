package workerkit;

/**
 * A deferred unit of work handed to a {@link workerkit.dispatch.WorkerDispatcher}.
 *
 * <p>A task runs exactly once inside its own worker. It must not share mutable state with
 * the caller or with sibling tasks; its only way out is the value it returns or the
 * exception it throws.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface Task<T> {

    /**
     * Runs the task to completion.
     *
     * @return the task's result, possibly {@code null}
     * @throws Exception any failure, captured at the worker boundary
     */
    T call() throws Exception;
}
