package com.phillippitts.uptimemonitor.service.probe.http;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches HTTP status codes against an accepted set such as {@code 200-299} or {@code 200-299,301,302}.
 * Ranges are inclusive.
 */
public final class StatusCodeMatcher {

    private record Range(int from, int to) {
        boolean contains(int code) {
            return code >= from && code <= to;
        }
    }

    private final String expression;
    private final List<Range> ranges;

    private StatusCodeMatcher(String expression, List<Range> ranges) {
        this.expression = expression;
        this.ranges = List.copyOf(ranges);
    }

    /**
     * Parses an accepted-codes expression.
     *
     * @param expression comma separated codes and inclusive ranges
     * @return matcher
     * @throws IllegalArgumentException if the expression is blank or malformed
     */
    public static StatusCodeMatcher parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Status code expression must not be blank");
        }
        List<Range> ranges = new ArrayList<>();
        for (String part : expression.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            int dash = p.indexOf('-');
            try {
                if (dash > 0) {
                    int from = Integer.parseInt(p.substring(0, dash).trim());
                    int to = Integer.parseInt(p.substring(dash + 1).trim());
                    if (from > to) {
                        throw new IllegalArgumentException("Invalid status code range: " + p);
                    }
                    ranges.add(new Range(from, to));
                } else {
                    int code = Integer.parseInt(p);
                    ranges.add(new Range(code, code));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid status code expression: " + expression, e);
            }
        }
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Status code expression has no codes: " + expression);
        }
        return new StatusCodeMatcher(expression.trim(), ranges);
    }

    public boolean matches(int statusCode) {
        for (Range r : ranges) {
            if (r.contains(statusCode)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return expression;
    }
}
