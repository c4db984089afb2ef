package com.phillippitts.uptimemonitor.service.metrics;

import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for check cycles.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Check latency per monitor type</li>
 *   <li>Outcome counts per type and final status (up, down, pending)</li>
 *   <li>Persistence failures and notification deliveries/failures per channel</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CheckMetrics {

    private static final String METRIC_PREFIX = "uptime.check";

    private final MeterRegistry registry;

    public CheckMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished probe.
     *
     * @param type          monitor type
     * @param status        final status after the retry policy
     * @param durationNanos probe duration in nanoseconds
     */
    public void recordCheck(MonitorType type, MonitorStatus status, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a probe, including timeouts")
                .tag("type", type.code())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of recorded check outcomes")
                .tag("type", type.code())
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementPersistenceFailure() {
        Counter.builder(METRIC_PREFIX + ".persistence.failure")
                .description("Number of check outcomes that could not be recorded")
                .register(registry)
                .increment();
    }

    /**
     * @param channel channel name
     * @param kind    delivered transition
     */
    public void incrementNotification(String channel, TransitionKind kind) {
        Counter.builder("uptime.notification.sent")
                .description("Number of delivered notifications")
                .tag("channel", channel)
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementNotificationFailure(String channel) {
        Counter.builder("uptime.notification.failure")
                .description("Number of notifications that could not be delivered")
                .tag("channel", channel)
                .register(registry)
                .increment();
    }
}
