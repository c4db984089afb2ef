package com.phillippitts.uptimemonitor.store;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.StatusRecord;

import java.time.Instant;
import java.util.List;

/**
 * Append-only history of recorded check outcomes.
 */
public interface StatusHistoryStore {

    StatusRecord appendRecord(CheckOutcome outcome);

    /**
     * Deletes every record with a timestamp strictly before {@code cutoff}.
     *
     * @return number of deleted records
     */
    int pruneOlderThan(Instant cutoff);

    /**
     * Most recent records first.
     */
    List<StatusRecord> findByMonitor(String monitorId, int limit);

    int deleteByMonitor(String monitorId);
}
