package com.phillippitts.uptimemonitor.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of one probe execution.
 *
 * <p>Probe runners produce outcomes with {@link MonitorStatus#UP} or {@link MonitorStatus#DOWN};
 * the retry policy may later turn a failure into {@link MonitorStatus#PENDING} through
 * {@link #withStatus(MonitorStatus)}, which returns a new instance.
 *
 * @param monitorId identifier of the checked monitor
 * @param status    outcome status
 * @param message   human-readable explanation (never null)
 * @param pingMs    measured latency in milliseconds, null when not measured
 * @param details   structured extras such as certificate expiry (never null, unmodifiable)
 * @param timestamp when the probe completed; the probe dispatcher restamps every outcome from the
 *                  engine clock through {@link #at(Instant)}
 */
public record CheckOutcome(
        String monitorId,
        MonitorStatus status,
        String message,
        Long pingMs,
        Map<String, Object> details,
        Instant timestamp
) {

    public CheckOutcome {
        Objects.requireNonNull(monitorId, "Monitor id must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static CheckOutcome up(String monitorId, String message, Long pingMs) {
        return new CheckOutcome(monitorId, MonitorStatus.UP, message, pingMs, Map.of(), Instant.now());
    }

    public static CheckOutcome up(String monitorId, String message, Long pingMs, Map<String, Object> details) {
        return new CheckOutcome(monitorId, MonitorStatus.UP, message, pingMs, details, Instant.now());
    }

    public static CheckOutcome down(String monitorId, String message) {
        return new CheckOutcome(monitorId, MonitorStatus.DOWN, message, null, Map.of(), Instant.now());
    }

    public static CheckOutcome down(String monitorId, String message, Long pingMs, Map<String, Object> details) {
        return new CheckOutcome(monitorId, MonitorStatus.DOWN, message, pingMs, details, Instant.now());
    }

    public boolean isUp() {
        return status == MonitorStatus.UP;
    }

    public CheckOutcome withStatus(MonitorStatus newStatus) {
        return new CheckOutcome(monitorId, newStatus, message, pingMs, details, timestamp);
    }

    /** Returns a copy completed at {@code completedAt}. */
    public CheckOutcome at(Instant completedAt) {
        return new CheckOutcome(monitorId, status, message, pingMs, details, completedAt);
    }

    public CheckOutcome withMessage(String newMessage) {
        return new CheckOutcome(monitorId, status, newMessage, pingMs, details, timestamp);
    }
}
