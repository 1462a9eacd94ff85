package workerkit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-assignment container that eventually holds a value or a failure.
 *
 * <p>A promise starts pending and settles exactly once, through {@link #complete(Object)}
 * or {@link #fail(Throwable)}. Later completion attempts are no-ops and return
 * {@code false}. Any number of observers may {@linkplain #await() block} on the same
 * promise or register {@linkplain #onComplete(Consumer) callbacks}.
 *
 * <p>Callbacks registered before settlement run on the thread that settles the promise;
 * callbacks registered afterwards run immediately on the registering thread. A callback
 * that throws is logged and does not affect other callbacks.
 *
 * <p>This class is thread-safe.
 *
 * @param <T> the value type
 */
public final class ResultPromise<T> {
  private static final Logger logger = Logger.getLogger(ResultPromise.class.getName());

  private final CountDownLatch settled = new CountDownLatch(1);
  private volatile Outcome<T> outcome;
  private List<Consumer<Outcome<T>>> callbacks = new ArrayList<>();

  public ResultPromise() {
  }

  public static <T> ResultPromise<T> fulfilled(T value) {
    ResultPromise<T> promise = new ResultPromise<>();
    promise.complete(value);
    return promise;
  }

  public static <T> ResultPromise<T> failed(Throwable error) {
    ResultPromise<T> promise = new ResultPromise<>();
    promise.fail(error);
    return promise;
  }

  /**
   * Combines promises into one that fulfills with all values in input order, or fails
   * with the first failure observed.
   *
   * @param promises the promises to combine
   * @return a promise of the values, in the same order as {@code promises}
   */
  public static <T> ResultPromise<List<T>> all(List<ResultPromise<T>> promises) {
    Objects.requireNonNull(promises, "promises");
    ResultPromise<List<T>> result = new ResultPromise<>();
    int size = promises.size();
    if (size == 0) {
      result.complete(List.of());
      return result;
    }
    Object[] slots = new Object[size];
    AtomicInteger remaining = new AtomicInteger(size);
    for (int i = 0; i < size; i++) {
      int index = i;
      promises.get(i).onComplete(outcome -> {
        if (outcome instanceof Outcome.Failed<T> failed) {
          result.fail(failed.error());
          return;
        }
        slots[index] = outcome.getOrThrow();
        if (remaining.decrementAndGet() == 0) {
          result.complete(toList(slots));
        }
      });
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  static <T> List<T> toList(Object[] slots) {
    List<T> values = new ArrayList<>(slots.length);
    for (Object slot : slots) {
      values.add((T) slot);
    }
    return values;
  }

  /**
   * Fulfills this promise.
   *
   * @param value the value, possibly {@code null}
   * @return {@code true} if this call settled the promise
   */
  public boolean complete(T value) {
    return settle(Outcome.fulfilled(value));
  }

  /**
   * Fails this promise.
   *
   * @param error the failure
   * @return {@code true} if this call settled the promise
   */
  public boolean fail(Throwable error) {
    return settle(Outcome.failed(error));
  }

  /**
   * Settles this promise with an existing outcome.
   *
   * @param result the outcome to adopt
   * @return {@code true} if this call settled the promise
   */
  public boolean completeWith(Outcome<T> result) {
    return settle(Objects.requireNonNull(result, "result"));
  }

  private boolean settle(Outcome<T> result) {
    List<Consumer<Outcome<T>>> pending;
    synchronized (this) {
      if (outcome != null) {
        return false;
      }
      outcome = result;
      pending = callbacks;
      callbacks = null;
    }
    settled.countDown();
    for (Consumer<Outcome<T>> callback : pending) {
      invoke(callback, result);
    }
    return true;
  }

  private static <T> void invoke(Consumer<Outcome<T>> callback, Outcome<T> result) {
    try {
      callback.accept(result);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Promise callback failed", e);
    }
  }

  /**
   * Registers a callback that receives the outcome once this promise settles.
   *
   * @param callback the callback
   * @return this promise
   */
  public ResultPromise<T> onComplete(Consumer<Outcome<T>> callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (this) {
      if (outcome == null) {
        callbacks.add(callback);
        return this;
      }
    }
    invoke(callback, outcome);
    return this;
  }

  /**
   * Registers a callback that receives either the value or the failure.
   *
   * @param action receives {@code (value, null)} on success or {@code (null, error)} on failure
   * @return this promise
   */
  public ResultPromise<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
    Objects.requireNonNull(action, "action");
    return onComplete(result -> {
      if (result instanceof Outcome.Failed<T> failed) {
        action.accept(null, failed.error());
      } else {
        action.accept(result.getOrThrow(), null);
      }
    });
  }

  /**
   * Blocks until this promise settles.
   *
   * @return the fulfilled value
   * @throws InterruptedException if interrupted while waiting
   * @throws RuntimeException the stored failure, when it is unchecked
   * @throws java.util.concurrent.CompletionException wrapping a checked failure
   */
  public T await() throws InterruptedException {
    settled.await();
    return outcome.getOrThrow();
  }

  /**
   * Blocks until this promise settles or the timeout elapses. On timeout the promise is
   * left untouched; whoever settles it later still can.
   *
   * @param timeout maximum time to wait
   * @return the fulfilled value
   * @throws InterruptedException if interrupted while waiting
   * @throws TimeoutException if the promise is still pending after {@code timeout}
   */
  public T await(Duration timeout) throws InterruptedException, TimeoutException {
    Objects.requireNonNull(timeout, "timeout");
    if (!settled.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
      throw new TimeoutException("Promise still pending after " + timeout);
    }
    return outcome.getOrThrow();
  }

  /**
   * Blocks until this promise settles, deferring any interrupt until it does.
   *
   * @return the fulfilled value
   */
  public T awaitUninterruptibly() {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          settled.await();
          return outcome.getOrThrow();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Returns the outcome without blocking.
   *
   * @return the outcome, or empty while pending
   */
  public Optional<Outcome<T>> poll() {
    return Optional.ofNullable(outcome);
  }

  public boolean isDone() {
    return outcome != null;
  }

  public <R> ResultPromise<R> map(Function<? super T, ? extends R> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    ResultPromise<R> derived = new ResultPromise<>();
    onComplete(result -> {
      if (result instanceof Outcome.Failed<T> failed) {
        derived.fail(failed.error());
        return;
      }
      try {
        derived.complete(mapper.apply(result.getOrThrow()));
      } catch (RuntimeException e) {
        derived.fail(e);
      }
    });
    return derived;
  }

  public <R> ResultPromise<R> flatMap(Function<? super T, ResultPromise<R>> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    ResultPromise<R> derived = new ResultPromise<>();
    onComplete(result -> {
      if (result instanceof Outcome.Failed<T> failed) {
        derived.fail(failed.error());
        return;
      }
      try {
        mapper.apply(result.getOrThrow()).onComplete(inner -> {
          if (inner instanceof Outcome.Failed<R> innerFailed) {
            derived.fail(innerFailed.error());
          } else {
            derived.complete(inner.getOrThrow());
          }
        });
      } catch (RuntimeException e) {
        derived.fail(e);
      }
    });
    return derived;
  }

  /**
   * Returns a promise that substitutes {@code fallback} for any failure.
   *
   * @param fallback value used when this promise fails
   * @return the derived promise
   */
  public ResultPromise<T> orElse(T fallback) {
    ResultPromise<T> derived = new ResultPromise<>();
    onComplete(result -> derived.complete(result.isSuccess() ? result.getOrThrow() : fallback));
    return derived;
  }

  /**
   * Returns a promise with the same outcome that first runs {@code action} on a value.
   * A throwing action fails the derived promise.
   *
   * @param action side effect applied to the value
   * @return the derived promise
   */
  public ResultPromise<T> peek(Consumer<? super T> action) {
    Objects.requireNonNull(action, "action");
    return map(value -> {
      action.accept(value);
      return value;
    });
  }

  /**
   * Returns a promise that fails with {@link IllegalStateException} when the value does not
   * match {@code predicate}.
   *
   * @param predicate the condition the value must satisfy
   * @return the derived promise
   */
  public ResultPromise<T> filter(Predicate<? super T> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    return map(value -> {
      if (!predicate.test(value)) {
        throw new IllegalStateException("Filter predicate rejected value: " + value);
      }
      return value;
    });
  }

  public CompletableFuture<T> toCompletableFuture() {
    CompletableFuture<T> future = new CompletableFuture<>();
    onComplete(result -> {
      if (result instanceof Outcome.Failed<T> failed) {
        future.completeExceptionally(failed.error());
      } else {
        future.complete(result.getOrThrow());
      }
    });
    return future;
  }

  @Override
  public String toString() {
    Outcome<T> current = outcome;
    return "ResultPromise[" + (current == null ? "pending" : current) + "]";
  }
}
