package workerkit;

import java.util.List;
import java.util.Objects;

/**
 * Raised by a race once every participating task has failed.
 *
 * <p>The {@linkplain #getCause() cause} is the last failure observed. Earlier failures are
 * attached as {@linkplain #getSuppressed() suppressed} exceptions in observation order.
 */
public class AggregateFailureException extends RuntimeException {

    private final int failureCount;

    /**
     * @param failures every failure, in observation order; the last one becomes the cause
     * @throws IllegalArgumentException if {@code failures} is empty
     */
    public AggregateFailureException(List<Throwable> failures) {
        super(message(failures), last(failures));
        this.failureCount = failures.size();
        for (int i = 0; i < failures.size() - 1; i++) {
            addSuppressed(failures.get(i));
        }
    }

    /**
     * Returns how many tasks failed.
     *
     * @return the number of failures
     */
    public int failureCount() {
        return failureCount;
    }

    private static String message(List<Throwable> failures) {
        Objects.requireNonNull(failures, "failures");
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        return "All " + failures.size() + " tasks failed; last error: " + last(failures);
    }

    private static Throwable last(List<Throwable> failures) {
        return failures.get(failures.size() - 1);
    }
}
