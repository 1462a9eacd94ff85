package workerkit.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff, optionally with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. With
 * jitter enabled the capped delay is scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * Creates a policy with jitter enabled.
   *
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, true);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      whether to randomize each delay
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long capped;
    if (attempts >= 63 || (1L << (attempts - 1)) > maxDelayMs / baseDelayMs) {
      capped = maxDelayMs;
    } else {
      capped = baseDelayMs * (1L << (attempts - 1));
    }
    if (!jitter) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }
}
