package com.phillippitts.uptimemonitor.exception;

/**
 * Base exception for all uptime-monitor application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class UptimeMonitorException extends RuntimeException {

    public UptimeMonitorException(String message) {
        super(message);
    }

    public UptimeMonitorException(String message, Throwable cause) {
        super(message, cause);
    }

    public UptimeMonitorException(Throwable cause) {
        super(cause);
    }
}
