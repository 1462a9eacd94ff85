package workerkit.spring.boot;

import workerkit.dispatch.ConcurrencyLimiter;
import workerkit.dispatch.ExponentialBackoffRetryPolicy;
import workerkit.dispatch.RetryPolicy;
import workerkit.dispatch.WorkerDispatcher;
import workerkit.platform.ExecutorWorkerPlatform;
import workerkit.platform.ThreadMessageTransport;
import workerkit.platform.ThreadWorkerPlatform;
import workerkit.spi.MessageTransport;
import workerkit.spi.MetricsExporter;
import workerkit.spi.WorkerPlatform;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for workerkit.
 *
 * <p>Wires a {@link WorkerDispatcher} over a {@link WorkerPlatform} chosen by
 * {@code workerkit.dispatcher.pool-size}, plus a {@link ConcurrencyLimiter}, a
 * {@link RetryPolicy} and a {@link MessageTransport} for linked channels. A
 * {@link MetricsExporter} bean, when present, is passed to the dispatcher.
 *
 * @see WorkerKitProperties
 * @see WorkerKitMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(WorkerDispatcher.class)
@EnableConfigurationProperties(WorkerKitProperties.class)
public class WorkerKitAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public WorkerPlatform workerPlatform(WorkerKitProperties props) {
    int poolSize = props.getDispatcher().getPoolSize();
    if (poolSize < 0) {
      throw new IllegalStateException(
          "workerkit.dispatcher.pool-size must be >= 0, got: " + poolSize);
    }
    return poolSize == 0 ? new ThreadWorkerPlatform() : new ExecutorWorkerPlatform(poolSize);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public WorkerDispatcher workerDispatcher(WorkerKitProperties props,
      WorkerPlatform workerPlatform,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = WorkerDispatcher.builder()
        .platform(workerPlatform)
        .namePrefix(props.getDispatcher().getNamePrefix())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ConcurrencyLimiter concurrencyLimiter(WorkerDispatcher workerDispatcher,
      WorkerKitProperties props) {
    return new ConcurrencyLimiter(workerDispatcher, props.getLimiter().getConcurrency());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy retryPolicy(WorkerKitProperties props) {
    WorkerKitProperties.Retry retry = props.getRetry();
    return new ExponentialBackoffRetryPolicy(
        retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.isJitter());
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageTransport messageTransport() {
    return new ThreadMessageTransport();
  }
}
