package com.phillippitts.uptimemonitor.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the monitor scheduler.
 */
@ConfigurationProperties(prefix = "monitor.scheduler")
@Validated
public class SchedulerProperties {

    /** Start checks for all active monitors when the application starts. */
    private boolean enabled = true;

    /** Global cap on checks running at the same time across all monitors; 0 means unlimited. */
    @Min(value = 0, message = "Max concurrent checks must not be negative")
    private int maxConcurrentChecks = 0;

    /** Delay before the first cycle after a monitor is (re)scheduled, in seconds. */
    @Min(value = 0, message = "Initial delay must not be negative")
    private int initialDelaySeconds = 0;

    /** Threads of the timer that re-arms check cycles. Cycles themselves run on the check pool. */
    @Positive(message = "Timer pool size must be positive")
    private int timerPoolSize = 2;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrentChecks() {
        return maxConcurrentChecks;
    }

    public void setMaxConcurrentChecks(int maxConcurrentChecks) {
        this.maxConcurrentChecks = maxConcurrentChecks;
    }

    public int getInitialDelaySeconds() {
        return initialDelaySeconds;
    }

    public void setInitialDelaySeconds(int initialDelaySeconds) {
        this.initialDelaySeconds = initialDelaySeconds;
    }

    public int getTimerPoolSize() {
        return timerPoolSize;
    }

    public void setTimerPoolSize(int timerPoolSize) {
        this.timerPoolSize = timerPoolSize;
    }
}
