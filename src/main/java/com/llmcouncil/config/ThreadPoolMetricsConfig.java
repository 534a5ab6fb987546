package com.llmcouncil.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tags;
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
 * Exposes council executor gauges via Micrometer:
 * <ul>
 *   <li>council.pool.size - current number of threads</li>
 *   <li>council.pool.active - threads running a model call</li>
 *   <li>council.pool.queued - calls waiting for a thread</li>
 *   <li>council.pool.completed - cumulative completed calls</li>
 *   <li>council.pool.max.size - configured maximum</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> councilExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("councilExecutor") ObjectProvider<ThreadPoolTaskExecutor> councilExecutorProvider) {
        this.councilExecutorProvider = councilExecutorProvider;
    }

    @Bean
    public MeterBinder councilExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = councilExecutorProvider.getObject().getThreadPoolExecutor();
            Tags tags = Tags.of("pool", "council");

            Gauge.builder("council.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .tags(tags)
                    .description("Current number of threads in the council pool")
                    .register(registry);
            Gauge.builder("council.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .tags(tags)
                    .description("Threads actively running a model call")
                    .register(registry);
            Gauge.builder("council.pool.queued", executor, e -> e.getQueue().size())
                    .tags(tags)
                    .description("Model calls waiting for a thread")
                    .register(registry);
            Gauge.builder("council.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .tags(tags)
                    .description("Cumulative count of completed model calls")
                    .register(registry);
            Gauge.builder("council.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .tags(tags)
                    .description("Configured maximum pool size")
                    .register(registry);

            LOG.info("Council thread pool metrics registered: council.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = councilExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Council Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
