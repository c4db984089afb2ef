package com.phillippitts.uptimemonitor.service.scheduler;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TaskTimer} backed by a Spring {@link TaskScheduler}.
 */
public class SpringTaskTimer implements TaskTimer {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public SpringTaskTimer(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Handle schedule(Runnable action, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(action, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
