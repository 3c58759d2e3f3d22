package com.phillippitts.voicebridge.config;

import com.phillippitts.voicebridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the streaming pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * All pools use {@link ThreadPoolExecutor.CallerRunsPolicy}: when pool and queue are full the
 * submitting thread runs the task, which slows producers down instead of dropping work.
 *
 * <p>MDC propagation: every pool copies the Log4j2 ThreadContext of the submitting thread to the
 * worker so {@code sessionId} and {@code requestId} survive the hop.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one provider fallback chain per segment. Chains block while waiting on provider
     * attempts, so this pool is sized for waiting rather than CPU.
     *
     * @return executor for segment dispatch
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        return buildExecutor(threadPoolProperties.getDispatch());
    }

    /**
     * Runs individual provider calls. Keeping them off the dispatch thread lets an attempt be
     * abandoned when its timeout expires.
     *
     * @return executor for provider attempts
     */
    @Bean(name = "providerExecutor")
    public Executor providerExecutor() {
        return buildExecutor(threadPoolProperties.getProvider());
    }

    /**
     * Drains per-session outboxes onto their connections. Tasks here never block on other
     * sessions, so a closing session cannot hold up delivery to a live one.
     *
     * @return executor for outbound delivery
     */
    @Bean(name = "outboundExecutor")
    public Executor outboundExecutor() {
        return buildExecutor(threadPoolProperties.getOutbound());
    }

    /**
     * Runs session close, which waits out the drain grace for in-flight segments and the
     * session's own outbox drain.
     *
     * @return executor for session shutdown
     */
    @Bean(name = "sessionCloseExecutor")
    public Executor sessionCloseExecutor() {
        return buildExecutor(threadPoolProperties.getClose());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
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
