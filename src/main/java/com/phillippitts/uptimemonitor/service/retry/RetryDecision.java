package com.phillippitts.uptimemonitor.service.retry;

import com.phillippitts.uptimemonitor.domain.MonitorStatus;

import java.time.Duration;

/**
 * Output of {@link RetryPolicy#evaluate}.
 *
 * @param status              final status to record: UP, PENDING or DOWN
 * @param consecutiveFailures failure counter to carry into the next cycle
 * @param nextDelay           delay before the next cycle
 */
public record RetryDecision(MonitorStatus status, int consecutiveFailures, Duration nextDelay) {

    public boolean isConfirmed() {
        return status != MonitorStatus.PENDING;
    }
}
