package workerkit.dispatch;

import workerkit.Outcome;
import workerkit.ResultPromise;
import workerkit.Task;
import workerkit.sync.Semaphore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds how many workers a batch of tasks occupies at once.
 *
 * <p>Each call to {@link #launchWithLimit(List, int)} allocates its own FIFO
 * {@link Semaphore}. A task is launched only after its permit is granted, and the permit is
 * released on every exit path once the worker has reported. Results land in index-addressed
 * slots, so the output order is the input order whatever the completion order.
 *
 * <p>On the first failure the batch fails with that error. Tasks still waiting for a permit
 * are then cancelled in one pass and never launched; workers already running are left to
 * finish.
 *
 * <p>This class is thread-safe.
 */
public final class ConcurrencyLimiter {
  private final WorkerDispatcher dispatcher;
  private final int defaultConcurrency;

  public ConcurrencyLimiter(WorkerDispatcher dispatcher) {
    this(dispatcher, 4);
  }

  /**
   * @param dispatcher         the dispatcher that launches each task
   * @param defaultConcurrency limit used by {@link #launchWithLimit(List)}
   * @throws IllegalArgumentException if {@code defaultConcurrency <= 0}
   */
  public ConcurrencyLimiter(WorkerDispatcher dispatcher, int defaultConcurrency) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    requirePositive(defaultConcurrency);
    this.defaultConcurrency = defaultConcurrency;
  }

  public int defaultConcurrency() {
    return defaultConcurrency;
  }

  /**
   * Launches tasks using the default concurrency.
   *
   * @see #launchWithLimit(List, int)
   */
  public <T> ResultPromise<List<T>> launchWithLimit(List<? extends Task<T>> tasks) {
    return launchWithLimit(tasks, defaultConcurrency);
  }

  /**
   * Launches every task with at most {@code concurrency} of them running at any instant.
   *
   * @param tasks       the tasks to run
   * @param concurrency maximum number of simultaneously running workers
   * @return promise of all results, in input order
   * @throws IllegalArgumentException if {@code concurrency <= 0}
   */
  public <T> ResultPromise<List<T>> launchWithLimit(List<? extends Task<T>> tasks, int concurrency) {
    requirePositive(concurrency);
    Objects.requireNonNull(tasks, "tasks");
    List<Task<T>> batch = new ArrayList<>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      batch.add(Objects.requireNonNull(tasks.get(i), "tasks[" + i + "]"));
    }

    ResultPromise<List<T>> result = new ResultPromise<>();
    if (batch.isEmpty()) {
      result.complete(List.of());
      return result;
    }
    Semaphore semaphore = new Semaphore(concurrency);
    Object[] slots = new Object[batch.size()];
    AtomicInteger remaining = new AtomicInteger(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      int index = i;
      semaphore.acquireAsync().onComplete(granted -> {
        if (granted instanceof Outcome.Failed<Void>) {
          return;
        }
        runHolding(semaphore, batch.get(index), index, slots, remaining, result);
      });
    }
    return result;
  }

  private <T> void runHolding(Semaphore semaphore, Task<T> task, int index, Object[] slots,
      AtomicInteger remaining, ResultPromise<List<T>> result) {
    if (result.isDone()) {
      abandon(semaphore);
      return;
    }
    ResultPromise<T> promise;
    try {
      promise = dispatcher.launch(task);
    } catch (RuntimeException e) {
      result.fail(e);
      abandon(semaphore);
      return;
    }
    promise.onComplete(outcome -> {
      try {
        if (outcome instanceof Outcome.Failed<T> failed) {
          result.fail(failed.error());
          semaphore.cancelWaiters();
        } else {
          slots[index] = outcome.getOrThrow();
          if (remaining.decrementAndGet() == 0) {
            result.complete(toList(slots));
          }
        }
      } finally {
        semaphore.release();
      }
    });
  }

  // Waiters go first so the release below never hands the permit to another grant callback
  private static void abandon(Semaphore semaphore) {
    semaphore.cancelWaiters();
    semaphore.release();
  }

  @SuppressWarnings("unchecked")
  private static <T> List<T> toList(Object[] slots) {
    List<T> values = new ArrayList<>(slots.length);
    for (Object slot : slots) {
      values.add((T) slot);
    }
    return values;
  }

  private static void requirePositive(int concurrency) {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0, got: " + concurrency);
    }
  }
}
