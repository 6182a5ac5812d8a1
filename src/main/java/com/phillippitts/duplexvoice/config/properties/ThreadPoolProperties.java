package com.phillippitts.duplexvoice.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three pools: the duplex loops ({@code threadpool.loop.*}), backchannel playback
 * ({@code threadpool.backchannel.*}) and SSE event pumping ({@code threadpool.event.*}).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties loop = new PoolProperties(4, 8, 0, "duplex-loop-");
    private PoolProperties backchannel = new PoolProperties(1, 2, 2, "backchannel-");
    private PoolProperties event = new PoolProperties(2, 8, 0, "event-pool-");

    public PoolProperties getLoop() {
        return loop;
    }

    public void setLoop(PoolProperties loop) {
        this.loop = loop;
    }

    public PoolProperties getBackchannel() {
        return backchannel;
    }

    public void setBackchannel(PoolProperties backchannel) {
        this.backchannel = backchannel;
    }

    public PoolProperties getEvent() {
        return event;
    }

    public void setEvent(PoolProperties event) {
        this.event = event;
    }

    /**
     * Sizing for one executor.
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
