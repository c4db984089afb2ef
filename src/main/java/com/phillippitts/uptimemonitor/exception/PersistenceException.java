package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown when recording a check outcome fails. The history append and the cached status update
 * are rolled back together; scheduling continues.
 */
public class PersistenceException extends UptimeMonitorException {

    private final String monitorId;

    public PersistenceException(String message, String monitorId, Throwable cause) {
        super(message + " (monitor: " + monitorId + ")", cause);
        this.monitorId = monitorId;
    }

    public String getMonitorId() {
        return monitorId;
    }
}
