package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown when a monitor identifier does not resolve in the configuration store,
 * typically because it was deleted while a check was in flight.
 */
public class MonitorNotFoundException extends UptimeMonitorException {

    private final String monitorId;

    public MonitorNotFoundException(String monitorId) {
        super("Monitor not found: " + monitorId);
        this.monitorId = monitorId;
    }

    public String getMonitorId() {
        return monitorId;
    }
}
