package com.phillippitts.voicebridge.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Four pools back the pipeline: {@code dispatch} runs one fallback chain per segment,
 * {@code provider} runs the individual provider calls so an attempt can be abandoned on timeout,
 * {@code outbound} drains per-session outboxes. {@code close} runs session shutdown, which blocks
 * for up to the drain grace; it has no queue so it grows a thread per concurrent close instead of
 * waiting behind one.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties dispatch = new PoolProperties(8, 32, 200, "dispatch-pool-");
    private PoolProperties provider = new PoolProperties(8, 32, 100, "provider-pool-");
    private PoolProperties outbound = new PoolProperties(4, 8, 500, "outbound-pool-");
    private PoolProperties close = new PoolProperties(2, 64, 0, "session-close-");

    public PoolProperties getDispatch() {
        return dispatch;
    }

    public void setDispatch(PoolProperties dispatch) {
        this.dispatch = dispatch;
    }

    public PoolProperties getProvider() {
        return provider;
    }

    public void setProvider(PoolProperties provider) {
        this.provider = provider;
    }

    public PoolProperties getOutbound() {
        return outbound;
    }

    public void setOutbound(PoolProperties outbound) {
        this.outbound = outbound;
    }

    public PoolProperties getClose() {
        return close;
    }

    public void setClose(PoolProperties close) {
        this.close = close;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
