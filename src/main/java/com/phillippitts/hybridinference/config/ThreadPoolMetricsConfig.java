package com.phillippitts.hybridinference.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes the local-inference pool as {@code local.pool.size}, {@code local.pool.active},
 * {@code local.pool.queued} and {@code local.pool.completed}, and the telemetry backlog as
 * {@code telemetry.pool.queued}.
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> localExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("localInferenceExecutor") ObjectProvider<ThreadPoolTaskExecutor> localExecutorProvider,
            @Qualifier("telemetryExecutor") ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider) {
        this.localExecutorProvider = localExecutorProvider;
        this.telemetryExecutorProvider = telemetryExecutorProvider;
    }

    /**
     * Binds executor metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder routingExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor local = localExecutorProvider.getObject().getThreadPoolExecutor();
            ThreadPoolExecutor telemetry = telemetryExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("local.pool.size", local, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the local inference pool")
                    .register(registry);

            Gauge.builder("local.pool.active", local, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively running local inference")
                    .register(registry);

            Gauge.builder("local.pool.queued", local, e -> e.getQueue().size())
                    .description("Number of local inference tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("local.pool.completed", local, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed local inference tasks")
                    .register(registry);

            Gauge.builder("telemetry.pool.queued", telemetry, e -> e.getQueue().size())
                    .description("Number of telemetry payloads waiting for delivery")
                    .register(registry);

            LOG.info("Thread pool metrics registered: local.pool.*, telemetry.pool.queued");
        };
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor local = localExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor telemetry = telemetryExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Local inference pool: size={}/{}, active={}, queued={}, completed={}; telemetry queued={}",
                local.getPoolSize(),
                local.getMaximumPoolSize(),
                local.getActiveCount(),
                local.getQueue().size(),
                local.getCompletedTaskCount(),
                telemetry.getQueue().size()
        );
    }
}
