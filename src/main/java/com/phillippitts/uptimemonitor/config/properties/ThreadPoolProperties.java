package com.phillippitts.uptimemonitor.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three pools exist:
 * <ul>
 *   <li>{@code check} - runs check cycles (probe, retry policy, record, notify)</li>
 *   <li>{@code probe} - runs the probe call itself so a cycle can abandon it on timeout</li>
 *   <li>{@code notification} - fire-and-forget delivery to notification channels</li>
 * </ul>
 *
 * <p>The check and probe pools hand tasks directly to a thread (queue capacity 0), so every due
 * monitor runs at once up to {@code max-pool-size}. A queue would hold tasks back until it filled,
 * leaving only the core threads busy.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties check = new PoolProperties(8, 256, 0, "check-pool-", RejectionPolicy.ABORT);
    private PoolProperties probe = new PoolProperties(8, 256, 0, "probe-pool-", RejectionPolicy.ABORT);
    private PoolProperties notification =
            new PoolProperties(2, 4, 100, "notify-pool-", RejectionPolicy.CALLER_RUNS);

    public PoolProperties getCheck() {
        return check;
    }

    public void setCheck(PoolProperties check) {
        this.check = check;
    }

    public PoolProperties getProbe() {
        return probe;
    }

    public void setProbe(PoolProperties probe) {
        this.probe = probe;
    }

    public PoolProperties getNotification() {
        return notification;
    }

    public void setNotification(PoolProperties notification) {
        this.notification = notification;
    }

    /**
     * What a saturated pool does with a new task.
     */
    public enum RejectionPolicy {
        /** The submitting thread runs the task itself. */
        CALLER_RUNS,
        /** The submission fails and the caller handles it. */
        ABORT
    }

    /**
     * Sizing of a single pool.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;
        private RejectionPolicy rejectionPolicy;

        public PoolProperties() {
            this(2, 4, 10, "pool-", RejectionPolicy.CALLER_RUNS);
        }

        public PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix,
                              RejectionPolicy rejectionPolicy) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
            this.rejectionPolicy = rejectionPolicy;
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

        public RejectionPolicy getRejectionPolicy() {
            return rejectionPolicy;
        }

        public void setRejectionPolicy(RejectionPolicy rejectionPolicy) {
            this.rejectionPolicy = rejectionPolicy;
        }
    }
}
