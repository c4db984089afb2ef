package com.phillippitts.uptimemonitor.service.scheduler;

import java.time.Duration;

/**
 * Single-shot timer used to arm the next check cycle of a monitor.
 */
@FunctionalInterface
public interface TaskTimer {

    /**
     * Runs {@code action} once after {@code delay}.
     *
     * @return handle that cancels the pending run
     * @throws org.springframework.core.task.TaskRejectedException if the timer is shut down
     */
    Handle schedule(Runnable action, Duration delay);

    @FunctionalInterface
    interface Handle {
        /** Cancels the pending run if it has not started. A run already in progress is not interrupted. */
        void cancel();
    }
}
