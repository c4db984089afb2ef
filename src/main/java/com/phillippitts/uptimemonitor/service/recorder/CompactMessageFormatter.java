package com.phillippitts.uptimemonitor.service.recorder;

import com.phillippitts.uptimemonitor.util.LogSanitizer;

/**
 * Shapes a probe message for the history table: one line, bounded length, ping appended.
 */
public final class CompactMessageFormatter {

    private CompactMessageFormatter() {}

    /**
     * @param message   raw message, may be null or multi-line
     * @param pingMs    latency to append, may be null
     * @param maxLength maximum length of the result
     * @return e.g. {@code "200 OK (123ms)"}
     */
    public static String format(String message, Long pingMs, int maxLength) {
        String base = LogSanitizer.singleLine(message);
        String suffix = pingMs == null ? "" : " (" + pingMs + "ms)";
        if (base.isEmpty()) {
            return LogSanitizer.truncate(suffix.trim(), maxLength);
        }
        if (base.length() + suffix.length() <= maxLength) {
            return base + suffix;
        }
        int room = maxLength - suffix.length();
        if (room <= 0) {
            return LogSanitizer.truncate(base, maxLength);
        }
        return LogSanitizer.truncate(base, room) + suffix;
    }
}
