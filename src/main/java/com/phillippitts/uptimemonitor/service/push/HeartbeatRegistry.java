package com.phillippitts.uptimemonitor.service.push;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last-seen heartbeat instant per push monitor, plus the instant each monitor started waiting for
 * its first heartbeat.
 *
 * <p>Written by the push endpoint, read by the push probe. Kept in memory only: after a restart every
 * push monitor waits one window for its reporter to call in again.
 */
@Component
public class HeartbeatRegistry {

    private final ConcurrentMap<String, Instant> lastSeen = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> watchedSince = new ConcurrentHashMap<>();

    public void recordHeartbeat(String monitorId, Instant at) {
        Objects.requireNonNull(monitorId, "monitorId");
        Objects.requireNonNull(at, "at");
        // Never move backwards if two reporters race
        lastSeen.merge(monitorId, at, (prev, next) -> next.isAfter(prev) ? next : prev);
    }

    public Optional<Instant> lastHeartbeat(String monitorId) {
        return Optional.ofNullable(lastSeen.get(monitorId));
    }

    /**
     * Starts the wait for a first heartbeat at {@code now} unless it already started.
     *
     * @return the instant the wait started
     */
    public Instant watchSince(String monitorId, Instant now) {
        Objects.requireNonNull(now, "now");
        return watchedSince.computeIfAbsent(Objects.requireNonNull(monitorId, "monitorId"), id -> now);
    }

    /**
     * Drops the heartbeat and the wait start, so the next check of the monitor starts a fresh window.
     */
    public void forget(String monitorId) {
        lastSeen.remove(monitorId);
        watchedSince.remove(monitorId);
    }
}
