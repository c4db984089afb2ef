package com.phillippitts.uptimemonitor.service.scheduler;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;

import java.time.Instant;

/**
 * Failure counter and notification bookkeeping of one monitor.
 *
 * <p>Mutated only by the check cycle while it holds the monitor's run lock; fields are volatile so
 * health and diagnostics readers see recent values. Survives a reschedule so that an edit does not
 * reset the retry budget or re-announce a known outage.
 */
final class MonitorRunState {

    private volatile int consecutiveFailures;
    private volatile MonitorStatus lastReportedStatus;
    private volatile Instant lastNotifiedAt;

    MonitorRunState(int consecutiveFailures, MonitorStatus lastReportedStatus, Instant lastNotifiedAt) {
        this.consecutiveFailures = consecutiveFailures;
        this.lastReportedStatus = lastReportedStatus;
        this.lastNotifiedAt = lastNotifiedAt;
    }

    /**
     * Rebuilds state from the monitor's cached status, e.g. after a restart or reactivation.
     *
     * <p>A monitor cached as DOWN starts with an exhausted retry budget, so the next failure stays
     * DOWN instead of going back through PENDING, and resends count from its last check. A cached
     * PENDING is not a confirmed status and is treated as unknown.
     */
    static MonitorRunState seededFrom(Monitor monitor, Instant now) {
        MonitorStatus cached = monitor.lastStatus();
        if (cached == MonitorStatus.DOWN) {
            Instant since = monitor.lastCheckAt() == null ? now : monitor.lastCheckAt();
            return new MonitorRunState(monitor.retries(), MonitorStatus.DOWN, since);
        }
        if (cached == MonitorStatus.UP) {
            return new MonitorRunState(0, MonitorStatus.UP, null);
        }
        return new MonitorRunState(0, null, null);
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }

    void consecutiveFailures(int value) {
        this.consecutiveFailures = value;
    }

    MonitorStatus lastReportedStatus() {
        return lastReportedStatus;
    }

    void lastReportedStatus(MonitorStatus status) {
        this.lastReportedStatus = status;
    }

    Instant lastNotifiedAt() {
        return lastNotifiedAt;
    }

    void lastNotifiedAt(Instant at) {
        this.lastNotifiedAt = at;
    }
}
