package workerkit.dispatch;

/**
 * Strategy for computing the delay before re-launching a failed task.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see WorkerDispatcher#retry(workerkit.Task, int, RetryPolicy, java.util.function.Predicate)
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
