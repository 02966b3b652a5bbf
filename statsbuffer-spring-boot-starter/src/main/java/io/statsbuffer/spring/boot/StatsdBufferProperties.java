package io.statsbuffer.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the StatsD buffer.
 *
 * @see StatsdBufferAutoConfiguration
 */
@ConfigurationProperties(prefix = "statsd.buffer")
public class StatsdBufferProperties {

    /**
     * Whether to aggregate metrics. When false a no-op client is registered instead.
     */
    private boolean enabled = true;

    /**
     * Interval between flushes of the aggregated metrics.
     */
    private Duration flushInterval = Duration.ofSeconds(1);

    /**
     * Capacity of the submission queue. Callers block while it is full.
     */
    private int queueCapacity = 100;

    /**
     * Maximum time to wait for the final flush on shutdown. Unset means wait indefinitely.
     */
    private Duration closeTimeout;

    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public void setCloseTimeout(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "statsd.buffer";

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
