package workerkit.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for workerkit.
 *
 * @see WorkerKitAutoConfiguration
 */
@ConfigurationProperties(prefix = "workerkit")
public class WorkerKitProperties {

    private final Dispatcher dispatcher = new Dispatcher();
    private final Limiter limiter = new Limiter();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Limiter getLimiter() {
        return limiter;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {
        /**
         * Prefix for generated worker names.
         */
        private String namePrefix = "worker-";

        /**
         * Pooled threads backing the workers. 0 gives every worker its own thread.
         */
        private int poolSize = 0;

        private long drainTimeoutMs = 5000;

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Limiter {
        private int concurrency = 4;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Retry {
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;
        private boolean jitter = true;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "workerkit";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
