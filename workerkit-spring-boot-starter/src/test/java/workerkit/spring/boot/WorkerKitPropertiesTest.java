package workerkit.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerKitPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(WorkerKitProperties.class);
            assertEquals("worker-", props.getDispatcher().getNamePrefix());
            assertEquals(0, props.getDispatcher().getPoolSize());
            assertEquals(5000, props.getDispatcher().getDrainTimeoutMs());
            assertEquals(4, props.getLimiter().getConcurrency());
            assertEquals(200, props.getRetry().getBaseDelayMs());
            assertEquals(60000, props.getRetry().getMaxDelayMs());
            assertTrue(props.getRetry().isJitter());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("workerkit", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "workerkit.dispatcher.name-prefix=batch-",
                "workerkit.dispatcher.pool-size=8",
                "workerkit.dispatcher.drain-timeout-ms=10000",
                "workerkit.limiter.concurrency=16",
                "workerkit.retry.base-delay-ms=500",
                "workerkit.retry.max-delay-ms=120000",
                "workerkit.retry.jitter=false",
                "workerkit.metrics.enabled=false",
                "workerkit.metrics.name-prefix=batch.workers"
        ).run(ctx -> {
            var props = ctx.getBean(WorkerKitProperties.class);
            assertEquals("batch-", props.getDispatcher().getNamePrefix());
            assertEquals(8, props.getDispatcher().getPoolSize());
            assertEquals(10000, props.getDispatcher().getDrainTimeoutMs());
            assertEquals(16, props.getLimiter().getConcurrency());
            assertEquals(500, props.getRetry().getBaseDelayMs());
            assertEquals(120000, props.getRetry().getMaxDelayMs());
            assertFalse(props.getRetry().isJitter());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("batch.workers", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(WorkerKitProperties.class)
    static class PropsConfig {
    }
}
