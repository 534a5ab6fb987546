package com.llmcouncil.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The council pool runs model calls; each fan-out occupies one thread per member for up to
 * the request timeout, so its maximum size bounds how many members can be queried at once
 * across all concurrent turns. Its queue capacity defaults to 0 (direct handoff): a
 * {@code ThreadPoolTaskExecutor} only grows past its core size once the queue is full, so a
 * queue would hold members back instead of calling them. The stream pool runs streaming turns; the event pool runs
 * title generation, which a streaming turn waits on.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties council = new PoolProperties(8, 64, 0, "council-pool-");
    private PoolProperties event = new PoolProperties(2, 8, 20, "event-pool-");
    private PoolProperties stream = new PoolProperties(4, 16, 50, "stream-pool-");

    public PoolProperties getCouncil() {
        return council;
    }

    public void setCouncil(PoolProperties council) {
        this.council = council;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    public PoolProperties getStream() {
        return stream;
    }

    public void setStream(PoolProperties stream) {
        this.stream = stream;
    }

    /**
     * Sizing of a single executor.
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
