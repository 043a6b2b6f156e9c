package com.phillippitts.speechgate.config;

import com.phillippitts.speechgate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for work that runs outside WebSocket handler threads.
 *
 * <p>Foreground recognition and synthesis run on the container's connection threads and only
 * block on the model access coordinator. The only background pool is the single-thread
 * pre-warm executor.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor for cache pre-warm runs.
     *
     * <p>One thread, tiny queue, {@link ThreadPoolExecutor.AbortPolicy}: a pre-warm request that
     * cannot be queued is rejected instead of running on the caller's connection thread.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext of the submitting thread so the
     * run is logged with the connection that triggered it.
     *
     * @return executor for pre-warm runs
     */
    @Bean(name = "prewarmExecutor")
    public Executor prewarmExecutor() {
        ThreadPoolProperties.PrewarmPoolProperties props = threadPoolProperties.getPrewarm();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
