package com.phillippitts.uptimemonitor.store;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Configuration store owning monitor definitions and their cached last status.
 *
 * <p>The scheduler only reads definitions and writes the cached status; create, update and
 * delete are used by the API layer.
 */
public interface MonitorConfigStore {

    Optional<Monitor> getMonitor(String id);

    List<Monitor> listActiveMonitors();

    List<Monitor> listMonitors();

    /**
     * Looks up the push monitor that owns a heartbeat token.
     *
     * @param pushToken token sent by the heartbeat reporter
     * @return the owning monitor, if any
     */
    Optional<Monitor> findByPushToken(String pushToken);

    /**
     * Inserts or replaces a definition. When replacing, the cached status of the stored monitor is kept.
     *
     * @return the stored monitor
     */
    Monitor save(Monitor monitor);

    /**
     * @return true when a monitor was removed
     */
    boolean delete(String id);

    /**
     * Updates the cached {@code (lastStatus, lastCheckAt)} pair.
     *
     * @throws com.phillippitts.uptimemonitor.exception.MonitorNotFoundException if the monitor no longer exists
     */
    void updateCachedStatus(String id, MonitorStatus status, Instant checkedAt);
}
