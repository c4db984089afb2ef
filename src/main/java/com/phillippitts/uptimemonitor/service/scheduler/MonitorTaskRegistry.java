package com.phillippitts.uptimemonitor.service.scheduler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-wide map of monitor id to its live {@link ScheduledTask}.
 *
 * <p>Insert, replace and remove for one id go through {@link ConcurrentMap#compute}, so they are
 * mutually exclusive per id: a concurrent reschedule and stop can never leave two live tasks.
 * Each id also owns a run lock that serializes its check cycles, including a cycle of a replaced
 * task that is still in flight.
 *
 * <p>Populated by {@link SchedulerLifecycle} at startup and drained on shutdown. Not persisted.
 */
public class MonitorTaskRegistry {

    private static final Logger LOG = LogManager.getLogger(MonitorTaskRegistry.class);

    private final ConcurrentMap<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    /**
     * Atomically replaces the task of a monitor. The previous task, if any, is cancelled before the
     * factory's result becomes visible.
     *
     * @param factory receives the previous task (or null) and returns the new, already armed, task
     * @return the new task
     */
    ScheduledTask replace(String monitorId, Function<ScheduledTask, ScheduledTask> factory) {
        return tasks.compute(monitorId, (id, previous) -> {
            if (previous != null) {
                previous.cancel();
            }
            return factory.apply(previous);
        });
    }

    /**
     * Removes and cancels the task of a monitor.
     *
     * @return the removed task, if there was one
     */
    Optional<ScheduledTask> remove(String monitorId) {
        ScheduledTask[] removed = new ScheduledTask[1];
        tasks.computeIfPresent(monitorId, (id, current) -> {
            current.cancel();
            removed[0] = current;
            return null;
        });
        releaseRunLock(monitorId);
        return Optional.ofNullable(removed[0]);
    }

    /**
     * Removes the task only if it is still the registered one. Used by a cycle that found its monitor
     * gone, so it cannot remove a task that replaced it meanwhile.
     */
    boolean removeIfCurrent(ScheduledTask task) {
        task.cancel();
        boolean removed = tasks.remove(task.getMonitorId(), task);
        if (removed) {
            releaseRunLock(task.getMonitorId());
        }
        return removed;
    }

    ReentrantLock runLock(String monitorId) {
        return runLocks.computeIfAbsent(monitorId, id -> new ReentrantLock());
    }

    // A cycle still holding the old lock re-checks its task's flag after locking, so dropping an
    // unlocked entry cannot let two cycles of one monitor overlap.
    private void releaseRunLock(String monitorId) {
        runLocks.computeIfPresent(monitorId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    public Optional<ScheduledTask> get(String monitorId) {
        return Optional.ofNullable(tasks.get(monitorId));
    }

    public boolean contains(String monitorId) {
        return tasks.containsKey(monitorId);
    }

    public int size() {
        return tasks.size();
    }

    public Set<String> monitorIds() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Cancels and removes every task.
     *
     * @return number of tasks drained
     */
    public int drain() {
        List<String> ids = List.copyOf(tasks.keySet());
        int drained = 0;
        for (String id : ids) {
            if (remove(id).isPresent()) {
                drained++;
            }
        }
        LOG.info("Drained {} scheduled task(s)", drained);
        return drained;
    }
}
