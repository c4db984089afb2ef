package com.phillippitts.uptimemonitor.service.health;

import com.phillippitts.uptimemonitor.service.scheduler.MonitorScheduler;
import com.phillippitts.uptimemonitor.service.scheduler.MonitorTaskRegistry;
import com.phillippitts.uptimemonitor.service.scheduler.SchedulerLifecycle;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SchedulerHealthIndicatorTest {

    private final MonitorConfigStore store = mock(MonitorConfigStore.class);
    private final MonitorScheduler scheduler = mock(MonitorScheduler.class);
    private final MonitorTaskRegistry registry = new MonitorTaskRegistry();

    @Test
    void downBeforeStart() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(store, scheduler, registry, true);

        Health health = new SchedulerHealthIndicator(lifecycle, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Scheduler not running");
    }

    @Test
    void upWhileRunning() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(store, scheduler, registry, true);
        lifecycle.start();

        Health health = new SchedulerHealthIndicator(lifecycle, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "running").containsEntry("scheduledTasks", 0);
    }

    @Test
    void downAfterStop() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(store, scheduler, registry, true);
        lifecycle.start();
        lifecycle.stop();

        assertThat(new SchedulerHealthIndicator(lifecycle, registry).health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void upWhenDisabled() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(store, scheduler, registry, false);

        Health health = new SchedulerHealthIndicator(lifecycle, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "disabled");
    }
}
