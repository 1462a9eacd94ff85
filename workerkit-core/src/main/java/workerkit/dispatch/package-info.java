/**
 * Worker dispatch with bounded fan-out.
 *
 * <p>{@link workerkit.dispatch.WorkerDispatcher} spawns one worker per task through a pluggable
 * {@linkplain workerkit.spi.WorkerPlatform platform} and tracks live workers in its own
 * {@link workerkit.dispatch.WorkerRegistry}. It offers single launches, all-of and first-of
 * composites, deadlines, and retry with a {@link workerkit.dispatch.RetryPolicy}.
 * {@link workerkit.dispatch.ConcurrencyLimiter} caps how many of a batch's workers run at once.
 *
 * @see workerkit.dispatch.WorkerDispatcher
 * @see workerkit.dispatch.ConcurrencyLimiter
 * @see workerkit.dispatch.ExponentialBackoffRetryPolicy
 */
package workerkit.dispatch;
