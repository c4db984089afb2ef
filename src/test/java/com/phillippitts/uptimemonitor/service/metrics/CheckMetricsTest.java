package com.phillippitts.uptimemonitor.service.metrics;

import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CheckMetricsTest {

    private SimpleMeterRegistry registry;
    private CheckMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CheckMetrics(registry);
    }

    @Test
    void recordsLatencyAndOutcomePerType() {
        metrics.recordCheck(MonitorType.HTTPS_CERT, MonitorStatus.UP, TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordCheck(MonitorType.HTTPS_CERT, MonitorStatus.PENDING, TimeUnit.MILLISECONDS.toNanos(80));

        assertThat(registry.get("uptime.check.latency").tag("type", "https-cert").timer().count()).isEqualTo(2);
        assertThat(registry.get("uptime.check.outcome").tags("type", "https-cert", "status", "up")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("uptime.check.outcome").tags("type", "https-cert", "status", "pending")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsPersistenceFailures() {
        metrics.incrementPersistenceFailure();
        metrics.incrementPersistenceFailure();

        assertThat(registry.get("uptime.check.persistence.failure").counter().count()).isEqualTo(2.0);
    }

    @Test
    void countsNotificationsPerChannelAndKind() {
        metrics.incrementNotification("log", TransitionKind.STILL_DOWN);
        metrics.incrementNotificationFailure("webhook");

        assertThat(registry.get("uptime.notification.sent").tags("channel", "log", "kind", "still_down")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("uptime.notification.failure").tag("channel", "webhook")
                .counter().count()).isEqualTo(1.0);
    }
}
