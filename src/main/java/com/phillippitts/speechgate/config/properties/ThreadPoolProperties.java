package com.phillippitts.speechgate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for background thread pools.
 *
 * <p>The pre-warm pool is deliberately a single thread: at most one pre-warm run may execute
 * at a time.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    private PrewarmPoolProperties prewarm = new PrewarmPoolProperties();

    public PrewarmPoolProperties getPrewarm() {
        return prewarm;
    }

    public void setPrewarm(PrewarmPoolProperties prewarm) {
        this.prewarm = prewarm;
    }

    /**
     * Pre-warm executor configuration.
     */
    public static class PrewarmPoolProperties {
        @Positive(message = "Queue capacity must be positive")
        private int queueCapacity = 1;
        private String threadNamePrefix = "prewarm-";
        @Positive(message = "Await termination must be positive")
        private int awaitTerminationSeconds = 10;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
