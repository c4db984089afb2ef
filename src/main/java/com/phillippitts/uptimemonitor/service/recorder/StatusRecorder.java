package com.phillippitts.uptimemonitor.service.recorder;

import com.phillippitts.uptimemonitor.config.properties.HistoryProperties;
import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.StatusRecord;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.exception.PersistenceException;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import com.phillippitts.uptimemonitor.store.StatusHistoryStore;
import com.phillippitts.uptimemonitor.store.TransactionRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Persists check outcomes.
 *
 * <p>The history append and the cached status update run in one unit of work: a reader sees both
 * or neither, and a failure in either undoes the other.
 */
public class StatusRecorder {

    private static final Logger LOG = LogManager.getLogger(StatusRecorder.class);

    private final TransactionRunner transactions;
    private final StatusHistoryStore historyStore;
    private final MonitorConfigStore configStore;
    private final HistoryProperties properties;

    public StatusRecorder(TransactionRunner transactions,
                          StatusHistoryStore historyStore,
                          MonitorConfigStore configStore,
                          HistoryProperties properties) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Appends the outcome to the history and updates the monitor's cached status.
     *
     * @param outcome final outcome of a cycle (UP, PENDING or DOWN)
     * @return the stored history row
     * @throws MonitorNotFoundException if the monitor was deleted; nothing is written
     * @throws PersistenceException     if either write fails; nothing is written
     */
    public StatusRecord record(CheckOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        CheckOutcome compact = outcome.withMessage(
                CompactMessageFormatter.format(outcome.message(), outcome.pingMs(), properties.getMaxMessageLength()));
        try {
            StatusRecord stored = transactions.inTransaction(() -> {
                StatusRecord record = historyStore.appendRecord(compact);
                configStore.updateCachedStatus(compact.monitorId(), compact.status(), compact.timestamp());
                return record;
            });
            LOG.debug("Recorded status={} for monitor {}", stored.status(), stored.monitorId());
            return stored;
        } catch (MonitorNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to record check outcome", outcome.monitorId(), e);
        }
    }
}
