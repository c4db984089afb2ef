package com.phillippitts.uptimemonitor.service.retry;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;

import java.time.Duration;

/**
 * Decides the final status of a cycle and the delay before the next one.
 *
 * <ul>
 *   <li>success: UP, counter reset, next run after {@code interval}</li>
 *   <li>failure with {@code consecutiveFailures < retries}: PENDING, counter + 1, next run after
 *       {@code retryInterval}</li>
 *   <li>failure otherwise: DOWN, counter unchanged, next run after {@code interval}</li>
 * </ul>
 *
 * Stateless; the caller owns the counter.
 */
public final class RetryPolicy {

    private RetryPolicy() {}

    public static RetryDecision evaluate(boolean success, int consecutiveFailures, Monitor monitor) {
        if (success) {
            return new RetryDecision(MonitorStatus.UP, 0, Duration.ofSeconds(monitor.interval()));
        }
        if (consecutiveFailures < monitor.retries()) {
            return new RetryDecision(MonitorStatus.PENDING, consecutiveFailures + 1,
                    Duration.ofSeconds(monitor.retryInterval()));
        }
        return new RetryDecision(MonitorStatus.DOWN, consecutiveFailures, Duration.ofSeconds(monitor.interval()));
    }
}
