package com.phillippitts.uptimemonitor.service.notification;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import com.phillippitts.uptimemonitor.service.metrics.CheckMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Detects status transitions and fans them out to the {@link NotificationChannel}s of the monitor:
 * those it has an enabled binding to, plus the always-on ones.
 *
 * <p>Transition rules, given the last confirmed status and the status just recorded:
 * <ul>
 *   <li>PENDING never notifies</li>
 *   <li>DOWN after anything but DOWN (including no history): {@link TransitionKind#DOWN}</li>
 *   <li>DOWN after DOWN: {@link TransitionKind#STILL_DOWN} once {@code resendInterval} seconds have
 *       passed since the last notification, never when {@code resendInterval} is 0</li>
 *   <li>UP after DOWN: {@link TransitionKind#UP}; a first-ever UP is silent</li>
 * </ul>
 *
 * Delivery is asynchronous; channel failures are logged and counted.
 */
public class NotificationGate {

    private static final Logger LOG = LogManager.getLogger(NotificationGate.class);

    private final List<NotificationChannel> channels;
    private final Executor notificationExecutor;
    private final CheckMetrics metrics;

    public NotificationGate(List<NotificationChannel> channels, Executor notificationExecutor, CheckMetrics metrics) {
        this.channels = List.copyOf(channels);
        this.notificationExecutor = Objects.requireNonNull(notificationExecutor, "notificationExecutor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        LOG.info("Notification channels registered: {}", this.channels.stream().map(NotificationChannel::name).toList());
    }

    /**
     * Pure transition decision.
     *
     * @param previous       last confirmed status (UP or DOWN), null when unknown
     * @param current        status just recorded
     * @param lastNotifiedAt when the last DOWN/STILL_DOWN notification fired, null if none
     * @param resendInterval seconds between repeated down notifications, 0 disables
     * @param now            current time
     * @return the transition to notify, if any
     */
    public static Optional<TransitionKind> decide(MonitorStatus previous,
                                                  MonitorStatus current,
                                                  Instant lastNotifiedAt,
                                                  int resendInterval,
                                                  Instant now) {
        if (current == MonitorStatus.PENDING) {
            return Optional.empty();
        }
        if (current == MonitorStatus.DOWN) {
            if (previous != MonitorStatus.DOWN) {
                return Optional.of(TransitionKind.DOWN);
            }
            if (resendInterval > 0 && lastNotifiedAt != null
                    && Duration.between(lastNotifiedAt, now).compareTo(Duration.ofSeconds(resendInterval)) >= 0) {
                return Optional.of(TransitionKind.STILL_DOWN);
            }
            return Optional.empty();
        }
        return previous == MonitorStatus.DOWN ? Optional.of(TransitionKind.UP) : Optional.empty();
    }

    /**
     * Delivers a transition to the monitor's channels on the notification executor. Never throws.
     */
    public void dispatch(Monitor monitor, TransitionKind kind, CheckOutcome outcome) {
        LOG.info("Monitor {} transition {}: {}", monitor.id(), kind, outcome.message());
        for (NotificationChannel channel : channels) {
            if (!channel.alwaysNotified() && !monitor.notifiesVia(channel.name())) {
                continue;
            }
            try {
                notificationExecutor.execute(() -> deliver(channel, monitor, kind, outcome));
            } catch (RejectedExecutionException e) {
                metrics.incrementNotificationFailure(channel.name());
                LOG.warn("Notification executor rejected {} for monitor {} on channel {}",
                        kind, monitor.id(), channel.name());
            }
        }
    }

    private void deliver(NotificationChannel channel, Monitor monitor, TransitionKind kind, CheckOutcome outcome) {
        try {
            channel.notify(monitor, kind, outcome);
            metrics.incrementNotification(channel.name(), kind);
        } catch (RuntimeException e) {
            metrics.incrementNotificationFailure(channel.name());
            LOG.warn("Notification {} for monitor {} failed on channel {}: {}",
                    kind, monitor.id(), channel.name(), e.getMessage());
        }
    }
}
