package com.phillippitts.hybridinference.config;

import com.phillippitts.hybridinference.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by the routing core.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs on-device generation when it is raced against a latency budget.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The routing thread must stay free to
     * time the race, so a saturated pool rejects the task and the racer reports a local failure,
     * which sends hybrid requests to the cloud.
     *
     * <p>Tasks are handed over as a {@code FutureTask} through {@code execute}, so losing a race
     * cancels the task with interruption.
     *
     * @return executor for local inference tasks
     */
    @Bean(name = "localInferenceExecutor")
    public ThreadPoolTaskExecutor localInferenceExecutor() {
        return build(threadPoolProperties.getLocal(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for fire-and-forget telemetry delivery.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The event router catches the
     * rejection and drops the payload, so telemetry never applies backpressure to callers.
     *
     * @return executor for telemetry dispatch
     */
    @Bean(name = "telemetryExecutor")
    public ThreadPoolTaskExecutor telemetryExecutor() {
        return build(threadPoolProperties.getTelemetry(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so that
     * routing request ids appear in async logs.
     */
    static TaskDecorator mdcPropagating() {
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
