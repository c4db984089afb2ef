package com.phillippitts.uptimemonitor.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for status history recording and retention.
 */
@Validated
@ConfigurationProperties(prefix = "monitor.history")
public class HistoryProperties {

    /** Records older than this many days are deleted by the pruning job. */
    @Positive
    private final int retentionDays;

    /** Whether the scheduled pruning job runs. */
    private final boolean pruneEnabled;

    /** Persisted messages are truncated to this many characters. */
    @Positive
    private final int maxMessageLength;

    @ConstructorBinding
    public HistoryProperties(Integer retentionDays, Boolean pruneEnabled, Integer maxMessageLength) {
        this.retentionDays = retentionDays == null ? 30 : retentionDays;
        this.pruneEnabled = pruneEnabled == null || pruneEnabled;
        this.maxMessageLength = maxMessageLength == null ? 255 : maxMessageLength;
    }

    /**
     * Defaults: 30 days retention, pruning enabled, 255 character messages.
     */
    public HistoryProperties() {
        this(null, null, null);
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public boolean isPruneEnabled() {
        return pruneEnabled;
    }

    public int getMaxMessageLength() {
        return maxMessageLength;
    }
}
