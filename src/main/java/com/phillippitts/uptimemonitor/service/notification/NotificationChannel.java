package com.phillippitts.uptimemonitor.service.notification;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.TransitionKind;

/**
 * Destination for status transition notifications (log, email, webhook, ...).
 *
 * <p>Implementations are invoked on the notification executor, never on a check thread. They may
 * block; they should throw {@link com.phillippitts.uptimemonitor.exception.NotificationException}
 * when delivery fails. Failures are logged and not retried.
 *
 * <p>A channel receives a monitor's transitions when the monitor has an enabled binding to the
 * channel's {@link #name()}, or always when {@link #alwaysNotified()} is true.
 */
public interface NotificationChannel {

    /** Short identifier used in logs and metrics. */
    String name();

    /** Whether every monitor's transitions reach this channel, bound or not. */
    default boolean alwaysNotified() {
        return false;
    }

    void notify(Monitor monitor, TransitionKind kind, CheckOutcome outcome);
}
