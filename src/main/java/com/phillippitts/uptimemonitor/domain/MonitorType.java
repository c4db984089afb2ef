package com.phillippitts.uptimemonitor.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of checks a monitor can run. The code is the external (API and store) name.
 */
public enum MonitorType {
    HTTP("http"),
    KEYWORD("keyword"),
    HTTPS_CERT("https-cert"),
    PORT("port"),
    MYSQL("mysql"),
    REDIS("redis"),
    ICMP("icmp"),
    PUSH("push");

    private final String code;

    MonitorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** True for the types probed through an HTTP request. */
    public boolean isHttpFamily() {
        return this == HTTP || this == KEYWORD || this == HTTPS_CERT;
    }

    /** True for the types that connect to a hostname and port. */
    public boolean requiresHostAndPort() {
        return this == PORT || this == MYSQL || this == REDIS;
    }

    @JsonCreator
    public static MonitorType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Monitor type must not be null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (MonitorType t : values()) {
            if (t.code.equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown monitor type: " + code);
    }
}
