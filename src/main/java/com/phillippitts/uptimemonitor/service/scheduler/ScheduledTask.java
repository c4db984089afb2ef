package com.phillippitts.uptimemonitor.service.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The scheduler's handle for one monitor: the pending single-shot timer, a "still scheduled" flag and
 * the monitor's {@link MonitorRunState}.
 *
 * <p>Once {@link #cancel()} has run, {@link #arm} refuses to arm again, so an in-flight cycle of a
 * stopped or replaced task can finish but never re-arms itself.
 */
public final class ScheduledTask {

    private final String monitorId;
    private final MonitorRunState state;
    private volatile boolean scheduled = true;
    private TaskTimer.Handle pending;
    private volatile Instant nextRunAt;

    ScheduledTask(String monitorId, MonitorRunState state) {
        this.monitorId = Objects.requireNonNull(monitorId, "monitorId");
        this.state = Objects.requireNonNull(state, "state");
    }

    public String getMonitorId() {
        return monitorId;
    }

    public boolean isScheduled() {
        return scheduled;
    }

    /** When the pending cycle is due, null while none is armed. */
    public Instant getNextRunAt() {
        return nextRunAt;
    }

    MonitorRunState state() {
        return state;
    }

    /**
     * Arms the next cycle unless the task was cancelled.
     *
     * @return true if a cycle was armed
     */
    synchronized boolean arm(TaskTimer timer, Runnable action, Duration delay, Instant now) {
        if (!scheduled) {
            return false;
        }
        pending = timer.schedule(action, delay);
        nextRunAt = now.plus(delay);
        return true;
    }

    /** Marks the timer fired so {@link #getNextRunAt()} reflects that no cycle is pending. */
    synchronized void fired() {
        pending = null;
        nextRunAt = null;
    }

    /** Idempotent. */
    synchronized void cancel() {
        scheduled = false;
        nextRunAt = null;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    @Override
    public String toString() {
        return "ScheduledTask[" + monitorId + ", scheduled=" + scheduled + ", nextRunAt=" + nextRunAt + "]";
    }
}
