package com.phillippitts.uptimemonitor.service.scheduler;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Objects;

/**
 * Populates the task registry from all active monitors once the context is up, and drains it on
 * shutdown before the executors are destroyed.
 */
public class SchedulerLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SchedulerLifecycle.class);

    private final MonitorConfigStore configStore;
    private final MonitorScheduler scheduler;
    private final MonitorTaskRegistry registry;
    private final boolean enabled;
    private volatile boolean running;

    public SchedulerLifecycle(MonitorConfigStore configStore,
                              MonitorScheduler scheduler,
                              MonitorTaskRegistry registry,
                              boolean enabled) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.enabled = enabled;
    }

    @Override
    public void start() {
        if (!enabled) {
            LOG.info("Monitor scheduler disabled (monitor.scheduler.enabled=false); no checks will run");
            running = true;
            return;
        }
        List<Monitor> active = configStore.listActiveMonitors();
        int scheduled = 0;
        for (Monitor monitor : active) {
            try {
                if (scheduler.schedule(monitor.id())) {
                    scheduled++;
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to schedule monitor {} at startup", monitor.id(), e);
            }
        }
        running = true;
        LOG.info("Monitor scheduler started: {}/{} active monitor(s) scheduled", scheduled, active.size());
    }

    @Override
    public void stop() {
        int drained = registry.drain();
        running = false;
        LOG.info("Monitor scheduler stopped; {} task(s) cancelled", drained);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
