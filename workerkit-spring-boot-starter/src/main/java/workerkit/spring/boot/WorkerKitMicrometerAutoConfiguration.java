package workerkit.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import workerkit.micrometer.MicrometerMetricsExporter;
import workerkit.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists, and {@code workerkit.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WorkerKitAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the dispatcher.
 */
@AutoConfiguration(before = WorkerKitAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "workerkit.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WorkerKitProperties.class)
public class WorkerKitMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WorkerKitProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
