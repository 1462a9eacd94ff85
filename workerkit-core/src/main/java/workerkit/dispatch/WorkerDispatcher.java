package workerkit.dispatch;

import workerkit.AggregateFailureException;
import workerkit.Outcome;
import workerkit.ResultPromise;
import workerkit.Task;
import workerkit.TaskFailureException;
import workerkit.platform.ThreadWorkerPlatform;
import workerkit.spi.MetricsExporter;
import workerkit.spi.WorkerHandle;
import workerkit.spi.WorkerPlatform;
import workerkit.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Spawns one share-nothing worker per task and reports its single result through a
 * {@link ResultPromise}.
 *
 * <p>Every worker is registered in this dispatcher's {@link WorkerRegistry} before it is
 * spawned. When the worker's result message arrives the dispatcher removes the entry, tears
 * the worker down, then settles the promise: fulfilled with the task's value, or failed with
 * a {@link TaskFailureException} carrying whatever the task threw. Task exceptions never
 * escape into the dispatcher or into sibling workers.
 *
 * <p>{@link #killAll()} terminates every live worker. Promises of killed workers are never
 * settled; callers that need a deadline should use {@link #launchWithTimeout} or
 * {@link ResultPromise#await(Duration)}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see WorkerDispatcher.Builder
 * @see ConcurrencyLimiter
 */
public final class WorkerDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerDispatcher.class.getName());

  private final WorkerPlatform platform;
  private final WorkerRegistry registry;
  private final MetricsExporter metrics;
  private final String namePrefix;
  private final long drainTimeoutMs;
  private final AtomicInteger nameCounter = new AtomicInteger();
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private ScheduledExecutorService timer;

  private WorkerDispatcher(Builder builder) {
    this.platform = builder.platform != null ? builder.platform : new ThreadWorkerPlatform();
    this.registry = builder.registry != null ? builder.registry : new WorkerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.namePrefix = Objects.requireNonNull(builder.namePrefix, "namePrefix");
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Launches {@code task} in a new worker with a generated name.
   *
   * @param task the task to run
   * @return promise of the task's result
   * @throws IllegalStateException if this dispatcher is closed
   */
  public <T> ResultPromise<T> launch(Task<T> task) {
    return launch(task, null);
  }

  /**
   * Launches {@code task} in a new worker.
   *
   * @param task the task to run
   * @param name worker name, or {@code null} to generate {@code <namePrefix><n>}
   * @return promise of the task's result
   * @throws IllegalArgumentException if a live worker already has {@code name}
   * @throws IllegalStateException if this dispatcher is closed
   */
  public <T> ResultPromise<T> launch(Task<T> task, String name) {
    Objects.requireNonNull(task, "task");
    ensureAccepting();
    WorkerRegistry.Entry entry = name != null ? registerNamed(name) : registerGenerated();
    ResultPromise<T> promise = new ResultPromise<>();
    metrics.incrementWorkersLaunched();
    registry.reportSize(metrics::recordActiveWorkers);
    try {
      WorkerHandle handle = platform.spawn(entry.name(), task,
          message -> onWorkerMessage(entry, message, promise));
      entry.attach(handle);
      logger.fine(() -> "Spawned worker " + entry.name());
    } catch (RuntimeException e) {
      if (registry.remove(entry)) {
        registry.reportSize(metrics::recordActiveWorkers);
        metrics.incrementTaskFailure();
        promise.fail(new TaskFailureException(entry.name(), e));
      }
    }
    return promise;
  }

  private WorkerRegistry.Entry registerNamed(String name) {
    WorkerRegistry.Entry entry = registry.tryRegister(name);
    if (entry == null) {
      throw new IllegalArgumentException("A worker named '" + name + "' is already active");
    }
    return entry;
  }

  private WorkerRegistry.Entry registerGenerated() {
    while (true) {
      WorkerRegistry.Entry entry = registry.tryRegister(namePrefix + nameCounter.getAndIncrement());
      if (entry != null) {
        return entry;
      }
    }
  }

  private <T> void onWorkerMessage(WorkerRegistry.Entry entry, Outcome<T> message,
      ResultPromise<T> promise) {
    if (!registry.remove(entry)) {
      logger.warning("Discarding result of worker " + entry.name() + " (no longer registered)");
      return;
    }
    entry.terminate();
    logger.fine(() -> "Worker " + entry.name() + " finished in " + entry.elapsedMs() + " ms");
    registry.reportSize(metrics::recordActiveWorkers);
    metrics.recordTaskDurationMs(entry.elapsedMs());
    if (message instanceof Outcome.Failed<T> failed) {
      metrics.incrementTaskFailure();
      promise.fail(new TaskFailureException(entry.name(), failed.error()));
    } else {
      metrics.incrementTaskSuccess();
      promise.completeWith(message);
    }
  }

  /**
   * Launches every task concurrently, one worker each.
   *
   * <p>The returned promise fulfills with all results in input order, or fails with the first
   * failure observed. Remaining workers are not cancelled and run to completion.
   *
   * @param tasks the tasks to run
   * @return promise of all results
   */
  public <T> ResultPromise<List<T>> launchAll(List<? extends Task<T>> tasks) {
    requireTasks(tasks);
    ensureAccepting();
    List<ResultPromise<T>> promises = new ArrayList<>(tasks.size());
    for (Task<T> task : tasks) {
      promises.add(launch(task));
    }
    return ResultPromise.all(promises);
  }

  /**
   * Launches tasks with at most {@code concurrency} workers alive at once.
   *
   * @see ConcurrencyLimiter#launchWithLimit(List, int)
   */
  public <T> ResultPromise<List<T>> launchWithLimit(List<? extends Task<T>> tasks, int concurrency) {
    return new ConcurrencyLimiter(this).launchWithLimit(tasks, concurrency);
  }

  /**
   * Runs tasks one after another, each in its own worker. Results are in input order.
   *
   * @param tasks the tasks to run
   * @return promise of all results
   */
  public <T> ResultPromise<List<T>> sequence(List<? extends Task<T>> tasks) {
    return launchWithLimit(tasks, 1);
  }

  /**
   * Launches every task concurrently and settles with the first success.
   *
   * <p>Failures only fail the race once every task has failed; the promise then fails with an
   * {@link AggregateFailureException} whose cause is the last failure observed. Losing
   * workers are not cancelled.
   *
   * @param tasks the competing tasks
   * @return promise of the winning result
   * @throws IllegalArgumentException if {@code tasks} is empty
   */
  public <T> ResultPromise<T> race(List<? extends Task<T>> tasks) {
    requireTasks(tasks);
    if (tasks.isEmpty()) {
      throw new IllegalArgumentException("tasks must not be empty");
    }
    ensureAccepting();
    ResultPromise<T> result = new ResultPromise<>();
    int total = tasks.size();
    List<Throwable> failures = new ArrayList<>(total);
    for (Task<T> task : tasks) {
      launch(task).onComplete(outcome -> {
        if (outcome instanceof Outcome.Failed<T> failed) {
          List<Throwable> all = null;
          synchronized (failures) {
            failures.add(failed.error());
            if (failures.size() == total) {
              all = List.copyOf(failures);
            }
          }
          if (all != null) {
            result.fail(new AggregateFailureException(all));
          }
        } else {
          result.completeWith(outcome);
        }
      });
    }
    return result;
  }

  /**
   * Launches {@code task} and fails the returned promise with a {@link TimeoutException} if it
   * has not finished within {@code timeout}.
   *
   * <p>The worker is not stopped at the deadline; it runs to completion and its result is
   * discarded.
   *
   * @param task    the task to run
   * @param timeout maximum time to wait for the result
   * @return promise of the task's result
   */
  public <T> ResultPromise<T> launchWithTimeout(Task<T> task, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    ResultPromise<T> inner = launch(task);
    ResultPromise<T> timed = new ResultPromise<>();
    ScheduledFuture<?> deadline = timer().schedule(
        () -> timed.fail(new TimeoutException("Task did not finish within " + timeout)),
        timeout.toNanos(), TimeUnit.NANOSECONDS);
    inner.onComplete(outcome -> {
      deadline.cancel(false);
      timed.completeWith(outcome);
    });
    return timed;
  }

  /**
   * Launches {@code task}, re-launching it after each failure until it succeeds or
   * {@code maxRetries} retries are spent.
   *
   * @see #retry(Task, int, RetryPolicy, Predicate)
   */
  public <T> ResultPromise<T> retry(Task<T> task, int maxRetries, RetryPolicy retryPolicy) {
    return retry(task, maxRetries, retryPolicy, error -> true);
  }

  /**
   * Launches {@code task}, re-launching it in a fresh worker after each failure.
   *
   * <p>The delay before retry {@code n} is {@code retryPolicy.computeDelayMs(n)}. Retrying
   * stops when {@code maxRetries} retries have failed or {@code retryIf} rejects the task's
   * exception; the promise then fails with the last {@link TaskFailureException}.
   *
   * @param task        the task to run
   * @param maxRetries  retries allowed after the first attempt
   * @param retryPolicy computes the delay before each retry
   * @param retryIf     decides from the task's exception whether to retry
   * @return promise of the first successful result
   */
  public <T> ResultPromise<T> retry(Task<T> task, int maxRetries, RetryPolicy retryPolicy,
      Predicate<? super Throwable> retryIf) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(retryIf, "retryIf");
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    ensureAccepting();
    ResultPromise<T> result = new ResultPromise<>();
    attempt(task, 0, new RetrySettings(maxRetries, retryPolicy, retryIf), result);
    return result;
  }

  private record RetrySettings(int maxRetries, RetryPolicy policy, Predicate<? super Throwable> retryIf) {
  }

  private <T> void attempt(Task<T> task, int failures, RetrySettings settings, ResultPromise<T> result) {
    ResultPromise<T> promise;
    try {
      promise = launch(task);
    } catch (RuntimeException e) {
      result.fail(e);
      return;
    }
    promise.onComplete(outcome -> {
      if (!(outcome instanceof Outcome.Failed<T> failed)) {
        result.completeWith(outcome);
        return;
      }
      int failedCount = failures + 1;
      try {
        Throwable cause = failed.error() instanceof TaskFailureException tfe ? tfe.getCause() : failed.error();
        if (failedCount > settings.maxRetries() || !settings.retryIf().test(cause) || !accepting.get()) {
          result.completeWith(outcome);
          return;
        }
        long delayMs = settings.policy().computeDelayMs(failedCount);
        logger.fine(() -> "Retrying task after " + delayMs + " ms (attempt " + (failedCount + 1) + ")");
        timer().schedule(() -> attempt(task, failedCount, settings, result), delayMs, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        result.completeWith(outcome);
      } catch (RuntimeException e) {
        result.fail(e);
      }
    });
  }

  /**
   * Forcibly terminates every live worker. Their promises are discarded and never settle.
   */
  public void killAll() {
    List<WorkerRegistry.Entry> killed = registry.removeAll();
    for (WorkerRegistry.Entry entry : killed) {
      try {
        entry.terminate();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to terminate worker " + entry.name(), e);
      }
    }
    if (!killed.isEmpty()) {
      logger.warning("Killed " + killed.size() + " active workers");
      metrics.incrementWorkersKilled(killed.size());
    }
    registry.reportSize(metrics::recordActiveWorkers);
  }

  public int activeWorkerCount() {
    return registry.size();
  }

  /**
   * Returns the names of live workers in launch order.
   *
   * @return an immutable snapshot
   */
  public List<String> activeWorkerNames() {
    return registry.names();
  }

  private void ensureAccepting() {
    if (!accepting.get()) {
      throw new IllegalStateException("WorkerDispatcher is closed");
    }
  }

  private static void requireTasks(List<? extends Task<?>> tasks) {
    Objects.requireNonNull(tasks, "tasks");
    for (int i = 0; i < tasks.size(); i++) {
      Objects.requireNonNull(tasks.get(i), "tasks[" + i + "]");
    }
  }

  private synchronized ScheduledExecutorService timer() {
    if (timer == null) {
      timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("workerkit-timer-"));
    }
    return timer;
  }

  /**
   * Initiates graceful shutdown: stops accepting new tasks, waits up to the drain timeout for
   * live workers to deliver, then kills the rest and closes the platform.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    try {
      if (!registry.awaitEmpty(drainTimeoutMs)) {
        logger.warning("Drain timeout exceeded; killing " + registry.size() + " workers: "
            + registry.names());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    killAll();
    synchronized (this) {
      if (timer != null) {
        timer.shutdownNow();
      }
    }
    platform.close();
  }

  /** Builder for {@link WorkerDispatcher}. */
  public static final class Builder {
    private WorkerPlatform platform;
    private WorkerRegistry registry;
    private MetricsExporter metrics;
    private String namePrefix = "worker-";
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the platform that spawns workers.
     *
     * <p>Optional. Defaults to {@link ThreadWorkerPlatform}. The dispatcher closes it on
     * {@link WorkerDispatcher#close()}.
     *
     * @param platform the worker platform
     * @return this builder
     */
    public Builder platform(WorkerPlatform platform) {
      this.platform = platform;
      return this;
    }

    /**
     * Sets the registry that tracks live workers.
     *
     * <p>Optional. Defaults to a fresh {@link WorkerRegistry}.
     *
     * @param registry the registry; must not be shared with another dispatcher
     * @return this builder
     */
    public Builder registry(WorkerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter for worker counters and gauges.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the prefix for generated worker names.
     *
     * <p>Optional. Defaults to {@code "worker-"}, giving {@code worker-0}, {@code worker-1}, ...
     *
     * @param namePrefix the name prefix
     * @return this builder
     */
    public Builder namePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link WorkerDispatcher#close()} waits for live
     * workers before killing them.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link WorkerDispatcher}
     * @throws NullPointerException if {@code namePrefix} is null
     * @throws IllegalArgumentException if {@code drainTimeoutMs < 0}
     */
    public WorkerDispatcher build() {
      return new WorkerDispatcher(this);
    }
  }
}
