package com.phillippitts.uptimemonitor.service.monitor;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.StatusRecord;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.service.push.HeartbeatRegistry;
import com.phillippitts.uptimemonitor.service.scheduler.MonitorScheduler;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import com.phillippitts.uptimemonitor.store.StatusHistoryStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Monitor CRUD that keeps the scheduler in step with the configuration store: create or update of an
 * active monitor schedules it, deactivation stops it, deletion stops it before removing it.
 *
 * <p>Deactivation and deletion also drop the monitor's heartbeat state, so a push monitor that comes
 * back waits a full window for its first heartbeat.
 */
public class MonitorService {

    private static final Logger LOG = LogManager.getLogger(MonitorService.class);

    private final MonitorConfigStore configStore;
    private final StatusHistoryStore historyStore;
    private final MonitorScheduler scheduler;
    private final HeartbeatRegistry heartbeats;

    public MonitorService(MonitorConfigStore configStore,
                          StatusHistoryStore historyStore,
                          MonitorScheduler scheduler,
                          HeartbeatRegistry heartbeats) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
    }

    public List<Monitor> list() {
        return configStore.listMonitors();
    }

    public Monitor get(String id) {
        return configStore.getMonitor(id).orElseThrow(() -> new MonitorNotFoundException(id));
    }

    public Monitor create(MonitorDefinition definition) {
        Monitor monitor = withPushToken(MonitorValidator.toMonitor("", definition));
        Monitor saved = configStore.save(monitor);
        LOG.info("Created monitor {} ({})", saved.id(), saved.type().code());
        if (saved.active()) {
            scheduler.schedule(saved.id());
        }
        return saved;
    }

    public Monitor update(String id, MonitorDefinition definition) {
        Monitor existing = get(id);
        Monitor updated = MonitorValidator.toMonitor(id, definition);
        if (updated.type() == MonitorType.PUSH && updated.config().pushToken() == null
                && existing.config().pushToken() != null) {
            updated = updated.toBuilder()
                    .config(updated.config().toBuilder().pushToken(existing.config().pushToken()).build())
                    .build();
        }
        Monitor saved = configStore.save(withPushToken(updated));
        LOG.info("Updated monitor {}", id);
        if (saved.active()) {
            scheduler.schedule(id);
        } else {
            scheduler.stop(id);
            heartbeats.forget(id);
        }
        return saved;
    }

    public Monitor setActive(String id, boolean active) {
        Monitor saved = configStore.save(get(id).withActive(active));
        if (active) {
            scheduler.schedule(id);
        } else {
            scheduler.stop(id);
            heartbeats.forget(id);
        }
        LOG.info("Monitor {} {}", id, active ? "activated" : "deactivated");
        return saved;
    }

    public void delete(String id) {
        get(id);
        scheduler.stop(id);
        configStore.delete(id);
        heartbeats.forget(id);
        LOG.info("Deleted monitor {}", id);
    }

    public List<StatusRecord> history(String id, int limit) {
        get(id);
        return historyStore.findByMonitor(id, limit);
    }

    static Monitor withPushToken(Monitor monitor) {
        if (monitor.type() != MonitorType.PUSH || monitor.config().pushToken() != null) {
            return monitor;
        }
        String token = UUID.randomUUID().toString().replace("-", "");
        return monitor.toBuilder().config(monitor.config().toBuilder().pushToken(token).build()).build();
    }
}
