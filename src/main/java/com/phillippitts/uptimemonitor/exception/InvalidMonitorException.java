package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown when a monitor definition submitted through the API fails validation.
 */
public class InvalidMonitorException extends UptimeMonitorException {

    private final String field;

    public InvalidMonitorException(String field, String reason) {
        super(reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
