package com.phillippitts.uptimemonitor.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for probe runners.
 */
@ConfigurationProperties(prefix = "monitor.probe")
@Validated
public class ProbeProperties {

    /** Timeout used when a monitor does not configure its own, in seconds. */
    @Positive(message = "Default timeout must be positive")
    private int defaultTimeoutSeconds = 10;

    /** Extra time granted on top of a probe's timeout before it is abandoned, in milliseconds. */
    @Min(value = 0, message = "Timeout slack must not be negative")
    private long timeoutSlackMillis = 2000;

    /** Executable used for ICMP checks. */
    @NotBlank(message = "Ping command must not be blank")
    private String pingCommand = "ping";

    /** Grace period for push monitors that do not configure one, in seconds. */
    @Min(value = 0, message = "Push grace must not be negative")
    private int defaultPushGraceSeconds = 10;

    /**
     * Resolves the timeout for a monitor.
     *
     * @param configured monitor-level timeout in seconds, may be null or non-positive
     * @return the monitor's timeout if set, otherwise the default
     */
    public Duration timeoutFor(Integer configured) {
        int seconds = configured == null || configured <= 0 ? defaultTimeoutSeconds : configured;
        return Duration.ofSeconds(seconds);
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public long getTimeoutSlackMillis() {
        return timeoutSlackMillis;
    }

    public void setTimeoutSlackMillis(long timeoutSlackMillis) {
        this.timeoutSlackMillis = timeoutSlackMillis;
    }

    public String getPingCommand() {
        return pingCommand;
    }

    public void setPingCommand(String pingCommand) {
        this.pingCommand = pingCommand;
    }

    public int getDefaultPushGraceSeconds() {
        return defaultPushGraceSeconds;
    }

    public void setDefaultPushGraceSeconds(int defaultPushGraceSeconds) {
        this.defaultPushGraceSeconds = defaultPushGraceSeconds;
    }
}
