package com.phillippitts.uptimemonitor.service.probe;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorType;

import java.time.Duration;
import java.util.Set;

/**
 * One protocol-specific health check strategy.
 *
 * <p>Implementations report the raw result of the check: {@code UP} when the target behaves as
 * configured, {@code DOWN} otherwise. Upside-down inversion, timeouts and retries are applied by the
 * caller. A runner may signal failure either by returning a {@code DOWN} outcome (useful when it has
 * details to attach) or by throwing {@link com.phillippitts.uptimemonitor.exception.ProbeException}.
 *
 * <p>Runners must honour {@code timeout} for their own I/O and must be safe to call concurrently for
 * different monitors.
 */
public interface ProbeRunner {

    /**
     * @return monitor types this runner handles
     */
    Set<MonitorType> supportedTypes();

    /**
     * Executes one check.
     *
     * @param monitor current monitor definition
     * @param timeout connect/request timeout for this check
     * @return raw outcome (UP or DOWN)
     * @throws com.phillippitts.uptimemonitor.exception.ProbeException on an expected check failure
     */
    CheckOutcome run(Monitor monitor, Duration timeout);
}
