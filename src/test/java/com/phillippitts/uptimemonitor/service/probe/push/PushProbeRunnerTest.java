package com.phillippitts.uptimemonitor.service.probe.push;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.service.push.HeartbeatRegistry;
import com.phillippitts.uptimemonitor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PushProbeRunnerTest {

    private static final Instant T0 = Instant.parse("2024-02-01T00:00:00Z");

    private HeartbeatRegistry heartbeats;
    private MutableClock clock;
    private PushProbeRunner runner;

    @BeforeEach
    void setUp() {
        heartbeats = new HeartbeatRegistry();
        clock = new MutableClock(T0);
        runner = new PushProbeRunner(heartbeats, 10, clock);
    }

    private static Monitor monitor(Integer grace) {
        return Monitor.builder("job", MonitorType.PUSH).interval(60)
                .config(MonitorConfig.builder().pushToken("tok").pushGraceSeconds(grace).build())
                .build();
    }

    @Test
    void firstCheckWithoutHeartbeatWaitsOneWindow() {
        CheckOutcome first = runner.run(monitor(null), Duration.ofSeconds(1));

        assertThat(first.status()).isEqualTo(MonitorStatus.UP);
        assertThat(first.message()).isEqualTo("Waiting for first heartbeat (0s of 70s)");

        clock.advance(Duration.ofSeconds(70));
        assertThat(runner.run(monitor(null), Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void missingFirstHeartbeatGoesDownAfterWindow() {
        runner.run(monitor(null), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(71));

        CheckOutcome late = runner.run(monitor(null), Duration.ofSeconds(1));

        assertThat(late.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(late.message()).isEqualTo("No heartbeat received within 70s");
    }

    @Test
    void cachedDownStaysDownUntilHeartbeat() {
        Monitor down = monitor(null).toBuilder().lastStatus(MonitorStatus.DOWN).build();

        CheckOutcome outcome = runner.run(down, Duration.ofSeconds(1));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).isEqualTo("No heartbeat received yet");

        heartbeats.recordHeartbeat("job", T0);
        assertThat(runner.run(down, Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void upsideDownCachedStatusIsReadOnTheRawSide() {
        // cached DOWN on an upside-down monitor means the raw check was UP
        Monitor inverted = monitor(null).toBuilder().upsideDown(true).lastStatus(MonitorStatus.DOWN).build();

        assertThat(runner.run(inverted, Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void heartbeatAfterWaitStartsUsesHeartbeatAge() {
        runner.run(monitor(null), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(50));
        heartbeats.recordHeartbeat("job", clock.instant());
        clock.advance(Duration.ofSeconds(60));

        CheckOutcome outcome = runner.run(monitor(null), Duration.ofSeconds(1));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.UP);
        assertThat(outcome.message()).isEqualTo("Heartbeat received 60s ago");
    }

    @Test
    void recentHeartbeatIsUp() {
        heartbeats.recordHeartbeat("job", T0);
        clock.advance(Duration.ofSeconds(30));

        CheckOutcome outcome = runner.run(monitor(null), Duration.ofSeconds(1));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.UP);
        assertThat(outcome.message()).isEqualTo("Heartbeat received 30s ago");
        assertThat(outcome.details()).containsEntry(PushProbeRunner.DETAIL_LAST_HEARTBEAT, T0.toString());
    }

    @Test
    void defaultGraceExtendsWindow() {
        heartbeats.recordHeartbeat("job", T0);

        clock.advance(Duration.ofSeconds(70));
        assertThat(runner.run(monitor(null), Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.UP);

        clock.advance(Duration.ofSeconds(1));
        CheckOutcome late = runner.run(monitor(null), Duration.ofSeconds(1));
        assertThat(late.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(late.message()).isEqualTo("No heartbeat for 71s (window 70s)");
    }

    @Test
    void monitorGraceOverridesDefault() {
        heartbeats.recordHeartbeat("job", T0);
        clock.advance(Duration.ofSeconds(65));

        assertThat(runner.run(monitor(0), Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(runner.run(monitor(-5), Duration.ofSeconds(1)).status()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void registryNeverMovesBackwards() {
        heartbeats.recordHeartbeat("job", T0.plusSeconds(10));
        heartbeats.recordHeartbeat("job", T0);

        assertThat(heartbeats.lastHeartbeat("job")).contains(T0.plusSeconds(10));
        heartbeats.forget("job");
        assertThat(heartbeats.lastHeartbeat("job")).isEmpty();
    }

    @Test
    void forgetRestartsTheWaitForAFirstHeartbeat() {
        assertThat(heartbeats.watchSince("job", T0)).isEqualTo(T0);
        assertThat(heartbeats.watchSince("job", T0.plusSeconds(5))).isEqualTo(T0);

        heartbeats.forget("job");

        assertThat(heartbeats.watchSince("job", T0.plusSeconds(5))).isEqualTo(T0.plusSeconds(5));
    }
}
