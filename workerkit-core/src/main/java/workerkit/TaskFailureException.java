package workerkit;

import java.util.Objects;

/**
 * Failure raised inside a task body, captured at the worker boundary.
 *
 * <p>The task's own exception, with its stack trace, is the {@linkplain #getCause() cause}.
 */
public class TaskFailureException extends RuntimeException {

    private final String workerName;

    /**
     * Creates a new instance for the given worker and underlying error.
     *
     * @param workerName name of the worker that ran the task
     * @param cause      the exception thrown by the task
     * @throws NullPointerException if {@code workerName} or {@code cause} is null
     */
    public TaskFailureException(String workerName, Throwable cause) {
        super("Task failed in worker " + Objects.requireNonNull(workerName, "workerName")
                + ": " + Objects.requireNonNull(cause, "cause"), cause);
        this.workerName = workerName;
    }

    /**
     * Returns the name of the worker the task ran in.
     *
     * @return the worker name
     */
    public String workerName() {
        return workerName;
    }
}
