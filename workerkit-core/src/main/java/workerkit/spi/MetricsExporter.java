package workerkit.spi;

/**
 * Observability hook for exporting worker counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of workers spawned.
     */
    void incrementWorkersLaunched();

    /**
     * Increments the count of tasks that delivered a value.
     */
    void incrementTaskSuccess();

    /**
     * Increments the count of tasks that delivered a failure.
     */
    void incrementTaskFailure();

    /**
     * Increments the count of workers forcibly terminated by {@code killAll()}.
     *
     * @param count number of workers terminated
     */
    void incrementWorkersKilled(int count);

    /**
     * Records the number of workers currently registered.
     *
     * @param active live worker count
     */
    void recordActiveWorkers(int active);

    /**
     * Records the wall-clock time from spawn to result delivery.
     *
     * @param durationMs task duration in milliseconds (always non-negative)
     */
    default void recordTaskDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementWorkersLaunched() {
        }

        @Override
        public void incrementTaskSuccess() {
        }

        @Override
        public void incrementTaskFailure() {
        }

        @Override
        public void incrementWorkersKilled(int count) {
        }

        @Override
        public void recordActiveWorkers(int active) {
        }
    }
}
