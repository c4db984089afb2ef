package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown when a heartbeat arrives for a push monitor that is paused.
 */
public class PushNotAcceptedException extends UptimeMonitorException {

    private final String monitorId;

    public PushNotAcceptedException(String monitorId) {
        super("Monitor " + monitorId + " is inactive and does not accept heartbeats");
        this.monitorId = monitorId;
    }

    public String getMonitorId() {
        return monitorId;
    }
}
