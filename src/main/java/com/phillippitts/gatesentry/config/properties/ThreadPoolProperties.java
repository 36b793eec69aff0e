package com.phillippitts.gatesentry.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>The vision pool hosts the single frame-consumer loop; it is sized one thread by default so frame
 * analysis stays strictly sequential.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private VisionPoolProperties vision = new VisionPoolProperties();

    public VisionPoolProperties getVision() {
        return vision;
    }

    public void setVision(VisionPoolProperties vision) {
        this.vision = vision;
    }

    /**
     * Vision consumer pool configuration.
     */
    public static class VisionPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 1;
        private int queueCapacity = 1;
        private int awaitTerminationSeconds = 10;
        private String threadNamePrefix = "vision-";

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

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
