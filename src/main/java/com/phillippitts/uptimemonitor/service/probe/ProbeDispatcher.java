package com.phillippitts.uptimemonitor.service.probe;

import com.phillippitts.uptimemonitor.config.properties.ProbeProperties;
import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Selects the {@link ProbeRunner} for a monitor's type and runs it under a hard timeout.
 *
 * <p>Every failure mode (probe exception, timeout, unexpected error, missing runner) is turned into a
 * {@link MonitorStatus#DOWN} outcome; nothing propagates to the caller. {@code upsideDown} inversion
 * is applied last, so callers only ever see the final up/down classification. Outcomes are stamped
 * with the completion time read from the engine clock.
 */
public class ProbeDispatcher {

    private static final Logger LOG = LogManager.getLogger(ProbeDispatcher.class);

    private final Map<MonitorType, ProbeRunner> runners;
    private final AsyncTaskExecutor probeExecutor;
    private final ProbeProperties properties;
    private final Clock clock;

    public ProbeDispatcher(List<ProbeRunner> runners, AsyncTaskExecutor probeExecutor, ProbeProperties properties) {
        this(runners, probeExecutor, properties, Clock.systemUTC());
    }

    public ProbeDispatcher(List<ProbeRunner> runners, AsyncTaskExecutor probeExecutor, ProbeProperties properties,
                           Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.properties = Objects.requireNonNull(properties, "properties");
        Map<MonitorType, ProbeRunner> byType = new EnumMap<>(MonitorType.class);
        for (ProbeRunner runner : runners) {
            for (MonitorType type : runner.supportedTypes()) {
                ProbeRunner previous = byType.put(type, runner);
                if (previous != null) {
                    throw new IllegalStateException("Two probe runners registered for type " + type.code()
                            + ": " + previous.getClass().getSimpleName() + ", " + runner.getClass().getSimpleName());
                }
            }
        }
        this.runners = Collections.unmodifiableMap(byType);
        LOG.info("Probe runners registered for types={}", byType.keySet());
    }

    /**
     * Runs the probe for a monitor and applies {@code upsideDown}.
     *
     * @param monitor current monitor definition
     * @return final UP or DOWN outcome, never null
     */
    public CheckOutcome probe(Monitor monitor) {
        CheckOutcome raw = runWithTimeout(monitor).at(clock.instant());
        return monitor.upsideDown() ? invert(raw) : raw;
    }

    public boolean supports(MonitorType type) {
        return runners.containsKey(type);
    }

    private CheckOutcome runWithTimeout(Monitor monitor) {
        ProbeRunner runner = runners.get(monitor.type());
        if (runner == null) {
            return CheckOutcome.down(monitor.id(), "No probe available for type " + monitor.type().code());
        }
        Duration timeout = properties.timeoutFor(monitor.config().connectTimeout());
        long hardTimeoutMs = timeout.toMillis() + properties.getTimeoutSlackMillis();

        Future<CheckOutcome> future;
        try {
            future = probeExecutor.submit(() -> runner.run(monitor, timeout));
        } catch (RejectedExecutionException e) {
            LOG.warn("Probe executor rejected check for monitor {}: {}", monitor.id(), e.toString());
            return CheckOutcome.down(monitor.id(), "Probe could not be started: executor saturated");
        }

        try {
            return future.get(hardTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.debug("Probe for monitor {} timed out after {}ms", monitor.id(), hardTimeoutMs);
            return CheckOutcome.down(monitor.id(), "Timeout after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            return failureOutcome(monitor, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CheckOutcome.down(monitor.id(), "Check interrupted");
        }
    }

    private static CheckOutcome failureOutcome(Monitor monitor, Throwable cause) {
        if (cause instanceof ProbeException pe) {
            LOG.debug("Probe failed: monitor={}, type={}, msg={}", monitor.id(), pe.getMonitorType(), pe.getMessage());
            return CheckOutcome.down(monitor.id(), pe.getMessage());
        }
        // A runner bug still only fails this one check
        LOG.warn("Probe for monitor {} threw unexpectedly", monitor.id(), cause);
        String msg = cause == null ? "unknown error" : cause.getClass().getSimpleName()
                + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
        return CheckOutcome.down(monitor.id(), msg);
    }

    static CheckOutcome invert(CheckOutcome raw) {
        return raw.withStatus(raw.status().inverted());
    }
}
