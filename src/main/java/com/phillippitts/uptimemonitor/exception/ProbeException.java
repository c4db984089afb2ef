package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown inside a probe runner when the target is unreachable, answers with a protocol error,
 * or fails an assertion (status code, keyword, certificate). Expected during normal operation:
 * the probe dispatcher turns it into a failed outcome and it is never logged as an error.
 */
public class ProbeException extends UptimeMonitorException {

    private final String monitorType;

    public ProbeException(String message, String monitorType) {
        super(message);
        this.monitorType = monitorType;
    }

    public ProbeException(String message, String monitorType, Throwable cause) {
        super(message, cause);
        this.monitorType = monitorType;
    }

    public String getMonitorType() {
        return monitorType;
    }
}
