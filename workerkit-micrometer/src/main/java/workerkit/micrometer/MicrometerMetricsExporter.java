package workerkit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import workerkit.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers worker counters, a live-worker gauge and a task duration timer with a
 * {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code workerkit.worker.launched}: workers spawned</li>
 *   <li>{@code workerkit.task.success}: tasks that delivered a value</li>
 *   <li>{@code workerkit.task.failure}: tasks that delivered a failure</li>
 *   <li>{@code workerkit.worker.killed}: workers terminated by {@code killAll()}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code workerkit.worker.active}: workers currently registered</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code workerkit.task.duration}: time from spawn to result delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter launched;
  private final Counter taskSuccess;
  private final Counter taskFailure;
  private final Counter killed;
  private final Gauge activeGauge;
  private final Timer taskDuration;

  private final AtomicInteger activeWorkers = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "workerkit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "workerkit");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several dispatchers
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "reports.workers"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.launched = Counter.builder(namePrefix + ".worker.launched")
        .description("Workers spawned")
        .register(registry);
    this.taskSuccess = Counter.builder(namePrefix + ".task.success")
        .description("Tasks that delivered a value")
        .register(registry);
    this.taskFailure = Counter.builder(namePrefix + ".task.failure")
        .description("Tasks that delivered a failure")
        .register(registry);
    this.killed = Counter.builder(namePrefix + ".worker.killed")
        .description("Workers forcibly terminated")
        .register(registry);
    this.activeGauge = Gauge.builder(namePrefix + ".worker.active", activeWorkers, AtomicInteger::get)
        .description("Workers currently registered")
        .register(registry);
    this.taskDuration = Timer.builder(namePrefix + ".task.duration")
        .description("Time from spawn to result delivery")
        .register(registry);
  }

  @Override
  public void incrementWorkersLaunched() {
    if (closed) return;
    launched.increment();
  }

  @Override
  public void incrementTaskSuccess() {
    if (closed) return;
    taskSuccess.increment();
  }

  @Override
  public void incrementTaskFailure() {
    if (closed) return;
    taskFailure.increment();
  }

  @Override
  public void incrementWorkersKilled(int count) {
    if (closed) return;
    killed.increment(count);
  }

  @Override
  public void recordActiveWorkers(int active) {
    if (closed) return;
    activeWorkers.set(active);
  }

  @Override
  public void recordTaskDurationMs(long durationMs) {
    if (closed) return;
    taskDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. after the
   * {@link workerkit.dispatch.WorkerDispatcher} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(launched, taskSuccess, taskFailure, killed, activeGauge, taskDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
