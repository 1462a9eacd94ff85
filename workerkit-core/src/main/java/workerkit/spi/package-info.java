/**
 * Service provider interfaces for pluggable worker spawning, message transport, and metrics.
 *
 * <ul>
 *   <li>{@link workerkit.spi.WorkerPlatform}: spawns one worker per task and reports one result</li>
 *   <li>{@link workerkit.spi.MessageTransport}: FIFO ports linking channel endpoints</li>
 *   <li>{@link workerkit.spi.MetricsExporter}: counters and gauges for monitoring</li>
 * </ul>
 */
package workerkit.spi;
