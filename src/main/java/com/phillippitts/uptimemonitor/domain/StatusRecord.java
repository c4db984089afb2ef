package com.phillippitts.uptimemonitor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted history row per recorded {@link CheckOutcome}. Append-only.
 *
 * @param id        store-assigned identifier
 * @param monitorId owning monitor
 * @param status    recorded status
 * @param message   compacted message
 * @param pingMs    latency in milliseconds, may be null
 * @param timestamp check time; the key for retention pruning
 */
public record StatusRecord(
        String id,
        String monitorId,
        MonitorStatus status,
        String message,
        Long pingMs,
        Instant timestamp
) {
    public StatusRecord {
        Objects.requireNonNull(id, "Record id must not be null");
        Objects.requireNonNull(monitorId, "Monitor id must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
    }
}
