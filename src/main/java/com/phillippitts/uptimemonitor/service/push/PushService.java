package com.phillippitts.uptimemonitor.service.push;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.exception.PushNotAcceptedException;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Accepts heartbeats for push monitors.
 */
public class PushService {

    private static final Logger LOG = LogManager.getLogger(PushService.class);

    private final MonitorConfigStore configStore;
    private final HeartbeatRegistry heartbeats;
    private final Clock clock;

    public PushService(MonitorConfigStore configStore, HeartbeatRegistry heartbeats, Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore");
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a heartbeat for the monitor owning {@code pushToken}.
     *
     * @return the monitor that received the heartbeat
     * @throws MonitorNotFoundException if no push monitor owns the token
     * @throws PushNotAcceptedException if the monitor is inactive
     */
    public Monitor heartbeat(String pushToken) {
        Monitor monitor = configStore.findByPushToken(pushToken)
                .orElseThrow(() -> new MonitorNotFoundException("push token"));
        if (!monitor.active()) {
            throw new PushNotAcceptedException(monitor.id());
        }
        Instant now = clock.instant();
        heartbeats.recordHeartbeat(monitor.id(), now);
        LOG.debug("Heartbeat received for monitor {}", monitor.id());
        return monitor;
    }
}
