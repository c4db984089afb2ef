package com.phillippitts.uptimemonitor.service.scheduler;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one recurring check task per active monitor.
 *
 * <p>Each task re-arms a single-shot timer after its cycle finishes, so a slow check delays its own
 * next run instead of overlapping with it. Timers fire on the timer pool; cycles run on the check
 * executor under a per-monitor run lock.
 *
 * <p>{@link #schedule} and {@link #stop} are safe to call from request threads at any time. After
 * {@code stop} returns no new cycle starts for that monitor; a cycle already probing finishes but
 * does not re-arm.
 */
public class MonitorScheduler {

    private static final Logger LOG = LogManager.getLogger(MonitorScheduler.class);

    public static final String MDC_MONITOR_ID = "monitorId";
    static final String MDC_MONITOR_TYPE = "monitorType";

    private final MonitorConfigStore configStore;
    private final MonitorTaskRegistry registry;
    private final CheckCycleRunner cycleRunner;
    private final TaskTimer timer;
    private final Executor checkExecutor;
    private final Duration initialDelay;
    private final Clock clock;

    public MonitorScheduler(MonitorConfigStore configStore,
                            MonitorTaskRegistry registry,
                            CheckCycleRunner cycleRunner,
                            TaskTimer timer,
                            Executor checkExecutor,
                            Duration initialDelay,
                            Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cycleRunner = Objects.requireNonNull(cycleRunner, "cycleRunner");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.checkExecutor = Objects.requireNonNull(checkExecutor, "checkExecutor");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * (Re)registers the task of a monitor, replacing any existing one. The current definition is read
     * now and again on every cycle.
     *
     * <p>A missing or inactive monitor is not scheduled; any task it still has is stopped.
     *
     * @param monitorId monitor identifier
     * @return true if a task is now scheduled
     */
    public boolean schedule(String monitorId) {
        Optional<Monitor> found = configStore.getMonitor(monitorId);
        if (found.isEmpty()) {
            LOG.info("Not scheduling monitor {}: it does not exist", monitorId);
            stop(monitorId);
            return false;
        }
        Monitor monitor = found.get();
        if (!monitor.active()) {
            LOG.info("Not scheduling monitor {}: it is inactive", monitorId);
            stop(monitorId);
            return false;
        }

        ScheduledTask task = registry.replace(monitorId, previous -> {
            MonitorRunState state = previous != null
                    ? previous.state()
                    : MonitorRunState.seededFrom(monitor, clock.instant());
            ScheduledTask fresh = new ScheduledTask(monitorId, state);
            arm(fresh, initialDelay);
            return fresh;
        });
        LOG.info("Scheduled monitor {} ({}, every {}s), first check at {}",
                monitorId, monitor.type().code(), monitor.interval(), task.getNextRunAt());
        return true;
    }

    /**
     * Cancels the task of a monitor. Idempotent.
     *
     * @return true if a task was removed
     */
    public boolean stop(String monitorId) {
        boolean removed = registry.remove(monitorId).isPresent();
        if (removed) {
            LOG.info("Stopped monitor {}", monitorId);
        }
        return removed;
    }

    public boolean isScheduled(String monitorId) {
        return registry.contains(monitorId);
    }

    public int scheduledCount() {
        return registry.size();
    }

    private void arm(ScheduledTask task, Duration delay) {
        try {
            task.arm(timer, () -> fire(task), delay, clock.instant());
        } catch (RejectedExecutionException e) {
            // Only happens while the timer shuts down
            LOG.warn("Timer rejected next check of monitor {}: {}", task.getMonitorId(), e.getMessage());
        }
    }

    private void fire(ScheduledTask task) {
        task.fired();
        if (!task.isScheduled()) {
            return;
        }
        try {
            checkExecutor.execute(() -> runCycle(task));
        } catch (RejectedExecutionException e) {
            LOG.warn("Check executor rejected cycle of monitor {}: {}", task.getMonitorId(), e.getMessage());
            rearmAfterRejection(task);
        }
    }

    // The rejected cycle is skipped, not lost: the task waits one interval and tries again
    private void rearmAfterRejection(ScheduledTask task) {
        Optional<Monitor> found = configStore.getMonitor(task.getMonitorId());
        if (found.isEmpty() || !found.get().active()) {
            registry.removeIfCurrent(task);
            return;
        }
        arm(task, Duration.ofSeconds(found.get().interval()));
    }

    /**
     * Runs one cycle of a task and re-arms it. Never throws.
     */
    void runCycle(ScheduledTask task) {
        String monitorId = task.getMonitorId();
        ReentrantLock runLock = registry.runLock(monitorId);
        runLock.lock();
        ThreadContext.put(MDC_MONITOR_ID, monitorId);
        try {
            if (!task.isScheduled()) {
                LOG.debug("Task for monitor {} was stopped before its cycle started", monitorId);
                return;
            }
            Optional<Monitor> found = configStore.getMonitor(monitorId);
            if (found.isEmpty() || !found.get().active()) {
                LOG.info("Monitor {} was {}; terminating its task", monitorId,
                        found.isEmpty() ? "deleted" : "deactivated");
                registry.removeIfCurrent(task);
                return;
            }
            Monitor monitor = found.get();
            ThreadContext.put(MDC_MONITOR_TYPE, monitor.type().code());

            Duration next = Duration.ofSeconds(monitor.interval());
            try {
                next = cycleRunner.execute(monitor, task.state());
            } catch (MonitorNotFoundException e) {
                LOG.info("Monitor {} was deleted during its check; terminating its task", monitorId);
                registry.removeIfCurrent(task);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Check of monitor {} interrupted", monitorId);
            } catch (RuntimeException e) {
                LOG.error("Check cycle of monitor {} failed unexpectedly; re-arming", monitorId, e);
            }
            arm(task, next);
        } finally {
            ThreadContext.remove(MDC_MONITOR_TYPE);
            ThreadContext.remove(MDC_MONITOR_ID);
            runLock.unlock();
        }
    }
}
