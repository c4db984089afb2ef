package com.phillippitts.uptimemonitor.service.notification;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Always-on channel writing transitions to the application log.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LogManager.getLogger(LoggingNotificationChannel.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean alwaysNotified() {
        return true;
    }

    @Override
    public void notify(Monitor monitor, TransitionKind kind, CheckOutcome outcome) {
        switch (kind) {
            case DOWN -> LOG.warn("[DOWN] {} ({}) is down: {}", monitor.name(), monitor.type().code(), outcome.message());
            case STILL_DOWN -> LOG.warn("[STILL DOWN] {} ({}) is still down: {}",
                    monitor.name(), monitor.type().code(), outcome.message());
            case UP -> LOG.info("[UP] {} ({}) is back up: {}", monitor.name(), monitor.type().code(), outcome.message());
        }
    }
}
