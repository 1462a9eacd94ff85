package workerkit;

import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Terminal state of a {@link ResultPromise}: either {@link Fulfilled} with a value or
 * {@link Failed} with an error.
 *
 * <p>Also the single message a worker sends back to its dispatcher.
 *
 * @param <T> the value type
 */
public sealed interface Outcome<T> permits Outcome.Fulfilled, Outcome.Failed {

    static <T> Outcome<T> fulfilled(T value) {
        return new Fulfilled<>(value);
    }

    static <T> Outcome<T> failed(Throwable error) {
        return new Failed<>(error);
    }

    /**
     * Returns {@code true} for {@link Fulfilled}.
     *
     * @return whether this outcome carries a value
     */
    boolean isSuccess();

    /**
     * Returns the value, or rethrows the failure.
     *
     * <p>Runtime exceptions and errors are rethrown as-is; checked exceptions are wrapped
     * in a {@link CompletionException}.
     *
     * @return the fulfilled value
     */
    T getOrThrow();

    /**
     * Successful outcome. The value may be {@code null}.
     *
     * @param value the result value
     */
    record Fulfilled<T>(T value) implements Outcome<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }
    }

    /**
     * Failed outcome.
     *
     * @param error the failure (never null)
     */
    record Failed<T>(Throwable error) implements Outcome<T> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            if (error instanceof Error e) {
                throw e;
            }
            throw new CompletionException(error);
        }
    }
}
