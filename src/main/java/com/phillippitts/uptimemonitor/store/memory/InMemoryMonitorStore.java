package com.phillippitts.uptimemonitor.store.memory;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.StatusRecord;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import com.phillippitts.uptimemonitor.store.StatusHistoryStore;
import com.phillippitts.uptimemonitor.store.TransactionRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-process implementation of the configuration and history stores.
 *
 * <p>One {@link ReadWriteLock} guards both maps. A transaction holds the write lock for its whole
 * duration, so readers see either none or all of its writes. Writes made inside a transaction are
 * journaled and undone if the work throws.
 *
 * <p>Contents are lost on restart.
 */
public class InMemoryMonitorStore implements MonitorConfigStore, StatusHistoryStore, TransactionRunner {

    private static final Logger LOG = LogManager.getLogger(InMemoryMonitorStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Monitor> monitors = new LinkedHashMap<>();
    private final Map<String, List<StatusRecord>> history = new LinkedHashMap<>();

    // Undo actions of the transaction running on the current thread, null outside a transaction
    private final ThreadLocal<Deque<Runnable>> journal = new ThreadLocal<>();

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        Objects.requireNonNull(work, "work");
        lock.writeLock().lock();
        boolean outermost = journal.get() == null;
        if (outermost) {
            journal.set(new ArrayDeque<>());
        }
        try {
            T result = work.get();
            if (outermost) {
                journal.remove();
            }
            return result;
        } catch (RuntimeException | Error e) {
            if (outermost) {
                rollback();
            }
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void rollback() {
        Deque<Runnable> undo = journal.get();
        journal.remove();
        if (undo == null) {
            return;
        }
        LOG.debug("Rolling back {} store write(s)", undo.size());
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
    }

    private void onUndo(Runnable action) {
        Deque<Runnable> undo = journal.get();
        if (undo != null) {
            undo.push(action);
        }
    }

    @Override
    public Optional<Monitor> getMonitor(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(monitors.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Monitor> listActiveMonitors() {
        lock.readLock().lock();
        try {
            return monitors.values().stream().filter(Monitor::active).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Monitor> listMonitors() {
        lock.readLock().lock();
        try {
            return List.copyOf(monitors.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Monitor> findByPushToken(String pushToken) {
        if (pushToken == null || pushToken.isBlank()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return monitors.values().stream()
                    .filter(m -> m.type() == MonitorType.PUSH)
                    .filter(m -> pushToken.equals(m.config().pushToken()))
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Monitor save(Monitor monitor) {
        Objects.requireNonNull(monitor, "monitor");
        lock.writeLock().lock();
        try {
            Monitor toStore = monitor.id().isBlank() ? monitor.withId(UUID.randomUUID().toString()) : monitor;
            Monitor existing = monitors.get(toStore.id());
            if (existing != null) {
                toStore = toStore.withCachedStatus(existing.lastStatus(), existing.lastCheckAt());
            }
            monitors.put(toStore.id(), toStore);
            return toStore;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            boolean removed = monitors.remove(id) != null;
            history.remove(id);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void updateCachedStatus(String id, MonitorStatus status, Instant checkedAt) {
        lock.writeLock().lock();
        try {
            Monitor current = monitors.get(id);
            if (current == null) {
                throw new MonitorNotFoundException(id);
            }
            monitors.put(id, current.withCachedStatus(status, checkedAt));
            onUndo(() -> monitors.computeIfPresent(id,
                    (k, m) -> m.withCachedStatus(current.lastStatus(), current.lastCheckAt())));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StatusRecord appendRecord(CheckOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        lock.writeLock().lock();
        try {
            StatusRecord record = new StatusRecord(
                    UUID.randomUUID().toString(),
                    outcome.monitorId(),
                    outcome.status(),
                    outcome.message(),
                    outcome.pingMs(),
                    outcome.timestamp());
            List<StatusRecord> rows = history.computeIfAbsent(outcome.monitorId(), k -> new ArrayList<>());
            rows.add(record);
            onUndo(() -> {
                List<StatusRecord> current = history.get(record.monitorId());
                if (current != null) {
                    current.remove(record);
                }
            });
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int pruneOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff");
        lock.writeLock().lock();
        try {
            int deleted = 0;
            for (List<StatusRecord> rows : history.values()) {
                Iterator<StatusRecord> it = rows.iterator();
                while (it.hasNext()) {
                    if (it.next().timestamp().isBefore(cutoff)) {
                        it.remove();
                        deleted++;
                    }
                }
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StatusRecord> findByMonitor(String monitorId, int limit) {
        lock.readLock().lock();
        try {
            List<StatusRecord> rows = history.getOrDefault(monitorId, List.of());
            return rows.stream()
                    .sorted(Comparator.comparing(StatusRecord::timestamp).reversed())
                    .limit(Math.max(0, limit))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deleteByMonitor(String monitorId) {
        lock.writeLock().lock();
        try {
            List<StatusRecord> removed = history.remove(monitorId);
            return removed == null ? 0 : removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
