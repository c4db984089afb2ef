package com.phillippitts.uptimemonitor.domain;

/**
 * Status of a monitor after one check cycle.
 *
 * <p>The numeric code is the value persisted with each status record.
 */
public enum MonitorStatus {
    DOWN(0),
    UP(1),
    PENDING(2);

    private final int code;

    MonitorStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns the opposite confirmed status. {@link #PENDING} has no opposite and is returned as is.
     */
    public MonitorStatus inverted() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case PENDING -> PENDING;
        };
    }

    public static MonitorStatus fromCode(int code) {
        for (MonitorStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + code);
    }
}
