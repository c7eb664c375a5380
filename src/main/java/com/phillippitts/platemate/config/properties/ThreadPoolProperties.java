package com.phillippitts.platemate.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the chat API executor and the location scheduler.
 * Defaults are conservative: the chat pool never needs more than one worker per session
 * because only one request may be in flight.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ChatPoolProperties chat = new ChatPoolProperties();
    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();

    public ChatPoolProperties getChat() {
        return chat;
    }

    public void setChat(ChatPoolProperties chat) {
        this.chat = chat;
    }

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Chat API executor pool configuration.
     */
    public static class ChatPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 4;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "chat-pool-";

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

    /**
     * Scheduler used for location retries, periodic location updates and geocode lookups.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "location-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
