package com.phillippitts.uptimemonitor.config.logging;

import com.phillippitts.uptimemonitor.service.scheduler.MonitorScheduler;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI, with the token of push URIs masked</li>
 *   <li>monitorId: for {@code /api/monitors/{id}} requests, under the key the scheduler uses</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads. Schedule and
 * stop calls made by a handler therefore log with the requestId of the API call that caused them.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MASK = "****";

    private static final Pattern PUSH_TOKEN = Pattern.compile("(/api/push/)[^/]+");
    private static final Pattern MONITOR_ID = Pattern.compile("/api/monitors/([^/]+)");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String uri = http.getRequestURI();
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", redact(uri));
                String monitorId = monitorIdOf(uri);
                if (monitorId != null) {
                    ThreadContext.put(MonitorScheduler.MDC_MONITOR_ID, monitorId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /** Masks the push token, which authenticates the heartbeat sender. */
    static String redact(String uri) {
        if (uri == null) {
            return null;
        }
        return PUSH_TOKEN.matcher(uri).replaceFirst("$1" + MASK);
    }

    static String monitorIdOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = MONITOR_ID.matcher(uri);
        return m.find() ? m.group(1) : null;
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
