package com.phillippitts.uptimemonitor.service.probe.push;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.service.push.HeartbeatRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Probe for passive {@code push} monitors. Performs no I/O: the monitor is up iff a heartbeat arrived
 * within the last {@code interval + grace} seconds.
 *
 * <p>Before the first heartbeat the window runs from the monitor's first check in this process, so
 * a new or reactivated monitor waits one window before going down. A monitor whose cached status is
 * already down stays down until a heartbeat arrives.
 */
public class PushProbeRunner implements ProbeRunner {

    static final String DETAIL_LAST_HEARTBEAT = "lastHeartbeat";

    private final HeartbeatRegistry heartbeats;
    private final int defaultGraceSeconds;
    private final Clock clock;

    public PushProbeRunner(HeartbeatRegistry heartbeats, int defaultGraceSeconds, Clock clock) {
        this.heartbeats = Objects.requireNonNull(heartbeats, "heartbeats");
        this.defaultGraceSeconds = defaultGraceSeconds;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Set<MonitorType> supportedTypes() {
        return Set.of(MonitorType.PUSH);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        Instant now = clock.instant();
        Duration window = windowOf(monitor);
        Optional<Instant> last = heartbeats.lastHeartbeat(monitor.id());
        if (last.isEmpty()) {
            return awaitingFirstHeartbeat(monitor, window, now);
        }

        Duration age = Duration.between(last.get(), now);
        Map<String, Object> details = Map.of(DETAIL_LAST_HEARTBEAT, last.get().toString());
        if (age.compareTo(window) > 0) {
            return CheckOutcome.down(monitor.id(),
                    "No heartbeat for " + age.toSeconds() + "s (window " + window.toSeconds() + "s)",
                    null, details);
        }
        return CheckOutcome.up(monitor.id(), "Heartbeat received " + Math.max(0, age.toSeconds()) + "s ago",
                null, details);
    }

    private CheckOutcome awaitingFirstHeartbeat(Monitor monitor, Duration window, Instant now) {
        if (wasDown(monitor)) {
            return CheckOutcome.down(monitor.id(), "No heartbeat received yet");
        }
        Instant since = heartbeats.watchSince(monitor.id(), now);
        Duration waited = Duration.between(since, now);
        if (waited.compareTo(window) > 0) {
            return CheckOutcome.down(monitor.id(),
                    "No heartbeat received within " + window.toSeconds() + "s");
        }
        return CheckOutcome.up(monitor.id(),
                "Waiting for first heartbeat (" + Math.max(0, waited.toSeconds()) + "s of "
                        + window.toSeconds() + "s)", null);
    }

    private Duration windowOf(Monitor monitor) {
        Integer configuredGrace = monitor.config().pushGraceSeconds();
        int grace = configuredGrace == null || configuredGrace < 0 ? defaultGraceSeconds : configuredGrace;
        return Duration.ofSeconds((long) monitor.interval() + grace);
    }

    // Cached status is after upsideDown inversion; compare on the raw side
    private static boolean wasDown(Monitor monitor) {
        MonitorStatus cached = monitor.lastStatus();
        if (cached == null) {
            return false;
        }
        MonitorStatus raw = monitor.upsideDown() ? cached.inverted() : cached;
        return raw == MonitorStatus.DOWN;
    }
}
