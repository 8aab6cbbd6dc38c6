package com.phillippitts.coordsim.config;

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
 * Exposes the stage executor as Micrometer gauges.
 *
 * <ul>
 *   <li>coordsim.stage.pool.size - current number of threads</li>
 *   <li>coordsim.stage.pool.active - threads running a collaborator call</li>
 *   <li>coordsim.stage.pool.queued - calls waiting in the queue</li>
 *   <li>coordsim.stage.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> stageExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("stageExecutor") ObjectProvider<ThreadPoolTaskExecutor> stageExecutorProvider) {
        this.stageExecutorProvider = stageExecutorProvider;
    }

    @Bean
    public MeterBinder stageExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = stageExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("coordsim.stage.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the stage pool")
                    .register(registry);

            Gauge.builder("coordsim.stage.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running collaborator calls")
                    .register(registry);

            Gauge.builder("coordsim.stage.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of collaborator calls waiting in the queue")
                    .register(registry);

            Gauge.builder("coordsim.stage.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed collaborator calls")
                    .register(registry);

            LOG.info("Stage pool metrics registered: coordsim.stage.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = stageExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Stage pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
