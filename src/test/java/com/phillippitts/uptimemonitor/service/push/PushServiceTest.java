package com.phillippitts.uptimemonitor.service.push;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.exception.PushNotAcceptedException;
import com.phillippitts.uptimemonitor.store.memory.InMemoryMonitorStore;
import com.phillippitts.uptimemonitor.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PushServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-01T08:00:00Z");

    private InMemoryMonitorStore store;
    private HeartbeatRegistry heartbeats;
    private PushService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitorStore();
        heartbeats = new HeartbeatRegistry();
        service = new PushService(store, heartbeats, new MutableClock(NOW));
        store.save(Monitor.builder("job", MonitorType.PUSH)
                .config(MonitorConfig.builder().pushToken("tok-1").build()).build());
    }

    @Test
    void recordsHeartbeatForOwningMonitor() {
        Monitor monitor = service.heartbeat("tok-1");

        assertThat(monitor.id()).isEqualTo("job");
        assertThat(heartbeats.lastHeartbeat("job")).contains(NOW);
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> service.heartbeat("tok-2")).isInstanceOf(MonitorNotFoundException.class);
    }

    @Test
    void inactiveMonitorRejectsHeartbeat() {
        store.save(store.getMonitor("job").orElseThrow().withActive(false));

        assertThatThrownBy(() -> service.heartbeat("tok-1")).isInstanceOf(PushNotAcceptedException.class);
        assertThat(heartbeats.lastHeartbeat("job")).isEmpty();
    }
}
