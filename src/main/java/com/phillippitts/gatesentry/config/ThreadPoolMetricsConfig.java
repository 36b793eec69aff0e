package com.phillippitts.gatesentry.config;

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
 * Exposes the vision executor through Micrometer gauges:
 * <ul>
 *   <li>gatesentry.vision.pool.size</li>
 *   <li>gatesentry.vision.pool.active</li>
 *   <li>gatesentry.vision.pool.queued</li>
 *   <li>gatesentry.vision.pool.completed</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> visionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("visionExecutor") ObjectProvider<ThreadPoolTaskExecutor> visionExecutorProvider) {
        this.visionExecutorProvider = visionExecutorProvider;
    }

    @Bean
    public MeterBinder visionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = visionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("gatesentry.vision.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the vision pool")
                    .register(registry);

            Gauge.builder("gatesentry.vision.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of vision threads actively executing")
                    .register(registry);

            Gauge.builder("gatesentry.vision.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of vision tasks waiting in the executor queue")
                    .register(registry);

            Gauge.builder("gatesentry.vision.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed vision tasks")
                    .register(registry);

            LOG.info("Vision thread pool metrics registered: gatesentry.vision.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = visionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Vision thread pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
