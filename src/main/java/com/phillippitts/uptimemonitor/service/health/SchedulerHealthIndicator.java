package com.phillippitts.uptimemonitor.service.health;

import com.phillippitts.uptimemonitor.service.scheduler.MonitorTaskRegistry;
import com.phillippitts.uptimemonitor.service.scheduler.SchedulerLifecycle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the monitor scheduler.
 *
 * <ul>
 *   <li>UP: scheduler running, with the number of live tasks</li>
 *   <li>UP with {@code status=disabled}: scheduling switched off by configuration</li>
 *   <li>DOWN: scheduler not started or already stopped</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerLifecycle lifecycle;
    private final MonitorTaskRegistry registry;

    public SchedulerHealthIndicator(SchedulerLifecycle lifecycle, MonitorTaskRegistry registry) {
        this.lifecycle = lifecycle;
        this.registry = registry;
    }

    @Override
    public Health health() {
        if (!lifecycle.isEnabled()) {
            return Health.up()
                    .withDetail("status", "disabled")
                    .withDetail("scheduledTasks", 0)
                    .build();
        }
        if (!lifecycle.isRunning()) {
            return Health.down()
                    .withDetail("status", "Scheduler not running")
                    .withDetail("scheduledTasks", registry.size())
                    .build();
        }
        return Health.up()
                .withDetail("status", "running")
                .withDetail("scheduledTasks", registry.size())
                .build();
    }
}
