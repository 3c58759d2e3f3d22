package com.phillippitts.voicebridge.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes executor gauges via Micrometer, tagged by pool name:
 * <ul>
 *   <li>voicebridge.pool.size - current number of threads</li>
 *   <li>voicebridge.pool.active - actively executing tasks</li>
 *   <li>voicebridge.pool.queued - tasks waiting in the queue</li>
 *   <li>voicebridge.pool.completed - cumulative completed tasks</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ObjectProvider<ThreadPoolTaskExecutor>> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(
            @Qualifier("dispatchExecutor") ObjectProvider<ThreadPoolTaskExecutor> dispatchExecutor,
            @Qualifier("providerExecutor") ObjectProvider<ThreadPoolTaskExecutor> providerExecutor,
            @Qualifier("outboundExecutor") ObjectProvider<ThreadPoolTaskExecutor> outboundExecutor,
            @Qualifier("sessionCloseExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionCloseExecutor) {
        pools.put("dispatch", dispatchExecutor);
        pools.put("provider", providerExecutor);
        pools.put("outbound", outboundExecutor);
        pools.put("close", sessionCloseExecutor);
    }

    /**
     * Binds executor gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers the pool gauges
     */
    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            pools.forEach((name, provider) -> {
                ThreadPoolTaskExecutor taskExecutor = provider.getIfAvailable();
                if (taskExecutor != null) {
                    bind(registry, name, taskExecutor.getThreadPoolExecutor());
                }
            });
            LOG.info("Thread pool metrics registered for pools={}", pools.keySet());
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("voicebridge.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("voicebridge.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("voicebridge.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("voicebridge.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs a pool health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools.forEach((name, provider) -> {
            ThreadPoolTaskExecutor taskExecutor = provider.getIfAvailable();
            if (taskExecutor == null) {
                return;
            }
            ThreadPoolExecutor executor = taskExecutor.getThreadPoolExecutor();
            LOG.info("Thread pool {}: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }
}
