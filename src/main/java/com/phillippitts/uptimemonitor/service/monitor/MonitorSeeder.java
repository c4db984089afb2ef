package com.phillippitts.uptimemonitor.service.monitor;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.exception.InvalidMonitorException;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Loads monitors declared in configuration into the store before the scheduler starts.
 * An invalid declaration fails startup.
 */
public final class MonitorSeeder {

    private static final Logger LOG = LogManager.getLogger(MonitorSeeder.class);

    private MonitorSeeder() {}

    /**
     * @return number of monitors stored
     * @throws IllegalStateException naming the first invalid declaration
     */
    public static int seed(MonitorConfigStore store, List<MonitorDefinition> definitions) {
        int index = 0;
        for (MonitorDefinition definition : definitions) {
            String id = definition.id() == null || definition.id().isBlank() ? "" : definition.id().trim();
            Monitor monitor;
            try {
                monitor = MonitorService.withPushToken(MonitorValidator.toMonitor(id, definition));
            } catch (InvalidMonitorException e) {
                throw new IllegalStateException("Invalid monitor.seed[" + index + "]." + e.getField()
                        + ": " + e.getMessage(), e);
            }
            Monitor saved = store.save(monitor);
            LOG.info("Seeded monitor {} ({}, active={})", saved.id(), saved.type().code(), saved.active());
            index++;
        }
        return index;
    }
}
