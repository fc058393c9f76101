package io.streamqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for stream queues.
 *
 * @see StreamQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "streamqueue")
public class StreamQueueProperties {

    /**
     * Storage backend: process-local memory or a shared Redis instance.
     */
    private Backend backend = Backend.MEMORY;

    /**
     * Whether newly created queues store messages in encoded form.
     */
    private boolean compressMessages = true;

    /**
     * Default time-to-live of a queue's stored contents.
     */
    private Duration ttl = Duration.ofMinutes(5);

    /**
     * Delay before a removed queue handle is deregistered. Zero removes immediately.
     */
    private Duration removalDelay = Duration.ofMillis(500);

    /**
     * How long a live tail keeps draining after a control event.
     */
    private Duration graceDelay = Duration.ofMillis(300);

    private final Redis redis = new Redis();
    private final Metrics metrics = new Metrics();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public boolean isCompressMessages() {
        return compressMessages;
    }

    public void setCompressMessages(boolean compressMessages) {
        this.compressMessages = compressMessages;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getRemovalDelay() {
        return removalDelay;
    }

    public void setRemovalDelay(Duration removalDelay) {
        this.removalDelay = removalDelay;
    }

    public Duration getGraceDelay() {
        return graceDelay;
    }

    public void setGraceDelay(Duration graceDelay) {
        this.graceDelay = graceDelay;
    }

    public Redis getRedis() {
        return redis;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Backend {
        MEMORY,
        REDIS
    }

    public static class Redis {
        /**
         * Prefix of the list key holding a queue's messages.
         */
        private String queuePrefix = "queue:";

        /**
         * Prefix of the channel carrying a queue's notifications.
         */
        private String channelPrefix = "channel:";

        public String getQueuePrefix() {
            return queuePrefix;
        }

        public void setQueuePrefix(String queuePrefix) {
            this.queuePrefix = queuePrefix;
        }

        public String getChannelPrefix() {
            return channelPrefix;
        }

        public void setChannelPrefix(String channelPrefix) {
            this.channelPrefix = channelPrefix;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "streamqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
