/**
 * Micrometer bridge for worker metrics.
 *
 * <p>{@link workerkit.micrometer.MicrometerMetricsExporter} implements
 * {@link workerkit.spi.MetricsExporter}; pass it to
 * {@link workerkit.dispatch.WorkerDispatcher.Builder#metrics}.
 */
package workerkit.micrometer;
