package com.phillippitts.uptimemonitor.service.recorder;

import com.phillippitts.uptimemonitor.config.properties.HistoryProperties;
import com.phillippitts.uptimemonitor.store.StatusHistoryStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Maintenance job deleting history rows older than the retention window. Runs on its own cron,
 * outside the check cycle.
 */
public class HistoryPruner {

    private static final Logger LOG = LogManager.getLogger(HistoryPruner.class);

    private final StatusHistoryStore historyStore;
    private final HistoryProperties properties;
    private final Clock clock;

    public HistoryPruner(StatusHistoryStore historyStore, HistoryProperties properties, Clock clock) {
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(cron = "${monitor.history.prune-cron:0 0 3 * * *}")
    public void scheduledPrune() {
        if (!properties.isPruneEnabled()) {
            LOG.debug("History pruning disabled");
            return;
        }
        try {
            pruneNow();
        } catch (RuntimeException e) {
            LOG.error("History pruning failed; will retry on next schedule", e);
        }
    }

    /**
     * Deletes rows with a timestamp strictly before {@code now - retentionDays}.
     *
     * @return number of deleted rows
     */
    public int pruneNow() {
        Instant cutoff = cutoff();
        int deleted = historyStore.pruneOlderThan(cutoff);
        LOG.info("Pruned {} status record(s) older than {} ({} days retention)",
                deleted, cutoff, properties.getRetentionDays());
        return deleted;
    }

    Instant cutoff() {
        return clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
    }
}
