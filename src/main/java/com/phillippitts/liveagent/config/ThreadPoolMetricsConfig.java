package com.phillippitts.liveagent.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pipeline and media pool gauges via Micrometer.
 *
 * <p>For each pool ({@code pipeline}, {@code media}):
 * <ul>
 *   <li>liveagent.pool.size - current thread count</li>
 *   <li>liveagent.pool.active - threads running a task</li>
 *   <li>liveagent.pool.queued - tasks waiting</li>
 *   <li>liveagent.pool.max.size - configured maximum</li>
 * </ul>
 * Each pipeline stage holds a thread for the whole call, so {@code pipeline} active threads track
 * concurrent sessions closely.
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, Executor> pools;

    public ThreadPoolMetricsConfig(@Qualifier("pipelineExecutor") Executor pipelineExecutor,
                                   @Qualifier("mediaExecutor") Executor mediaExecutor) {
        this.pools = Map.of("pipeline", pipelineExecutor, "media", mediaExecutor);
    }

    @Bean
    public MeterBinder liveAgentPoolMetrics() {
        return registry -> {
            pools.forEach((name, pool) -> {
                ThreadPoolExecutor executor = unwrap(pool);
                if (executor == null) {
                    return;
                }
                Gauge.builder("liveagent.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                        .description("Current number of threads in the pool")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("liveagent.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                        .description("Threads actively executing tasks")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("liveagent.pool.queued", executor, e -> e.getQueue().size())
                        .description("Tasks waiting in the queue")
                        .tag("pool", name)
                        .register(registry);
                Gauge.builder("liveagent.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                        .description("Configured maximum pool size")
                        .tag("pool", name)
                        .register(registry);
            });
            LOG.info("Thread pool metrics registered: liveagent.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        pools.forEach((name, pool) -> {
            ThreadPoolExecutor executor = unwrap(pool);
            if (executor != null) {
                LOG.info("Thread pool {}: size={}/{}, active={}, queued={}, completed={}",
                        name,
                        executor.getPoolSize(),
                        executor.getMaximumPoolSize(),
                        executor.getActiveCount(),
                        executor.getQueue().size(),
                        executor.getCompletedTaskCount());
            }
        });
    }

    private static ThreadPoolExecutor unwrap(Executor pool) {
        return pool instanceof ThreadPoolTaskExecutor task ? task.getThreadPoolExecutor() : null;
    }
}
