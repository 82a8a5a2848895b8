package com.phillippitts.voiceinventory.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The capture pool runs recognizer callbacks and silent restarts off the request thread.
 * The extraction pool is a single worker so that at most one model round is in flight;
 * transcripts arriving meanwhile wait in its queue.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private CapturePoolProperties capture = new CapturePoolProperties();
    private ExtractionPoolProperties extraction = new ExtractionPoolProperties();

    public CapturePoolProperties getCapture() {
        return capture;
    }

    public void setCapture(CapturePoolProperties capture) {
        this.capture = capture;
    }

    public ExtractionPoolProperties getExtraction() {
        return extraction;
    }

    public void setExtraction(ExtractionPoolProperties extraction) {
        this.extraction = extraction;
    }

    /**
     * Capture callback pool configuration.
     */
    public static class CapturePoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "capture-pool-";

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
     * Extraction worker configuration. Pool size is fixed at one.
     */
    public static class ExtractionPoolProperties {
        private int queueCapacity = 20;
        private String threadNamePrefix = "extraction-pool-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
