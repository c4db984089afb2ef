package com.phillippitts.uptimemonitor.service.scheduler;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import com.phillippitts.uptimemonitor.exception.PersistenceException;
import com.phillippitts.uptimemonitor.service.metrics.CheckMetrics;
import com.phillippitts.uptimemonitor.service.notification.NotificationGate;
import com.phillippitts.uptimemonitor.service.probe.ProbeDispatcher;
import com.phillippitts.uptimemonitor.service.recorder.StatusRecorder;
import com.phillippitts.uptimemonitor.service.retry.RetryDecision;
import com.phillippitts.uptimemonitor.service.retry.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One check cycle: probe, retry policy, record, notify.
 *
 * <p>Callers guarantee that at most one cycle runs per monitor at a time. Probe and notification
 * failures never escape; a persistence failure is logged and the cycle still completes.
 */
public class CheckCycleRunner {

    private static final Logger LOG = LogManager.getLogger(CheckCycleRunner.class);

    private final ProbeDispatcher dispatcher;
    private final StatusRecorder recorder;
    private final NotificationGate notificationGate;
    private final CheckConcurrencyGuard concurrencyGuard;
    private final CheckMetrics metrics;
    private final Clock clock;

    public CheckCycleRunner(ProbeDispatcher dispatcher,
                            StatusRecorder recorder,
                            NotificationGate notificationGate,
                            CheckConcurrencyGuard concurrencyGuard,
                            CheckMetrics metrics,
                            Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.notificationGate = Objects.requireNonNull(notificationGate, "notificationGate");
        this.concurrencyGuard = Objects.requireNonNull(concurrencyGuard, "concurrencyGuard");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs one cycle and updates {@code state}.
     *
     * @return delay before the next cycle
     * @throws InterruptedException if interrupted while waiting for a global concurrency permit
     * @throws com.phillippitts.uptimemonitor.exception.MonitorNotFoundException if the monitor was
     *         deleted before its outcome could be recorded
     */
    Duration execute(Monitor monitor, MonitorRunState state) throws InterruptedException {
        CheckOutcome probed;
        long start;
        concurrencyGuard.acquire();
        try {
            start = System.nanoTime();
            probed = dispatcher.probe(monitor);
        } finally {
            concurrencyGuard.release();
        }
        long elapsedNanos = System.nanoTime() - start;

        RetryDecision decision = RetryPolicy.evaluate(probed.isUp(), state.consecutiveFailures(), monitor);
        CheckOutcome outcome = probed.withStatus(decision.status());
        state.consecutiveFailures(decision.consecutiveFailures());
        metrics.recordCheck(monitor.type(), decision.status(), elapsedNanos);
        LOG.debug("Check finished: status={}, failures={}/{}, next in {}s, msg={}",
                decision.status(), decision.consecutiveFailures(), monitor.retries(),
                decision.nextDelay().toSeconds(), outcome.message());

        try {
            recorder.record(outcome);
        } catch (PersistenceException e) {
            metrics.incrementPersistenceFailure();
            LOG.error("Could not record outcome of monitor {}; scheduling continues", monitor.id(), e);
        }

        if (decision.isConfirmed()) {
            notifyIfTransition(monitor, state, outcome);
        }
        return decision.nextDelay();
    }

    private void notifyIfTransition(Monitor monitor, MonitorRunState state, CheckOutcome outcome) {
        Optional<TransitionKind> transition = NotificationGate.decide(
                state.lastReportedStatus(), outcome.status(), state.lastNotifiedAt(),
                monitor.resendInterval(), clock.instant());
        transition.ifPresent(kind -> {
            notificationGate.dispatch(monitor, kind, outcome);
            if (kind != TransitionKind.UP) {
                state.lastNotifiedAt(clock.instant());
            } else {
                state.lastNotifiedAt(null);
            }
        });
        state.lastReportedStatus(outcome.status());
    }
}
