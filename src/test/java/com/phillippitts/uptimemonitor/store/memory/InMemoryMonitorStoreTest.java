package com.phillippitts.uptimemonitor.store.memory;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.StatusRecord;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMonitorStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryMonitorStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitorStore();
    }

    private CheckOutcome outcome(String id, Instant at) {
        return new CheckOutcome(id, MonitorStatus.UP, "OK", 1L, Map.of(), at);
    }

    @Test
    void blankIdGetsGenerated() {
        Monitor saved = store.save(Monitor.builder("", MonitorType.HTTP).build());

        assertThat(saved.id()).isNotBlank();
        assertThat(store.getMonitor(saved.id())).contains(saved);
    }

    @Test
    void saveKeepsCachedStatusOfExistingMonitor() {
        store.save(Monitor.builder("m", MonitorType.HTTP).build());
        store.updateCachedStatus("m", MonitorStatus.DOWN, T0);

        Monitor updated = store.save(Monitor.builder("m", MonitorType.HTTP).name("renamed").build());

        assertThat(updated.name()).isEqualTo("renamed");
        assertThat(updated.lastStatus()).isEqualTo(MonitorStatus.DOWN);
        assertThat(updated.lastCheckAt()).isEqualTo(T0);
    }

    @Test
    void listsOnlyActiveMonitors() {
        store.save(Monitor.builder("a", MonitorType.HTTP).build());
        store.save(Monitor.builder("b", MonitorType.HTTP).active(false).build());

        assertThat(store.listActiveMonitors()).extracting(Monitor::id).containsExactly("a");
        assertThat(store.listMonitors()).hasSize(2);
    }

    @Test
    void findsPushMonitorByToken() {
        store.save(Monitor.builder("p", MonitorType.PUSH)
                .config(MonitorConfig.builder().pushToken("tok").build()).build());
        store.save(Monitor.builder("h", MonitorType.HTTP)
                .config(MonitorConfig.builder().pushToken("other").build()).build());

        assertThat(store.findByPushToken("tok")).map(Monitor::id).contains("p");
        assertThat(store.findByPushToken("other")).isEmpty();
        assertThat(store.findByPushToken(" ")).isEmpty();
    }

    @Test
    void updatingMissingMonitorThrows() {
        assertThatThrownBy(() -> store.updateCachedStatus("nope", MonitorStatus.UP, T0))
                .isInstanceOf(MonitorNotFoundException.class);
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        store.appendRecord(outcome("m", T0));
        store.appendRecord(outcome("m", T0.plusSeconds(60)));
        store.appendRecord(outcome("m", T0.plusSeconds(120)));

        assertThat(store.findByMonitor("m", 2))
                .extracting(StatusRecord::timestamp)
                .containsExactly(T0.plusSeconds(120), T0.plusSeconds(60));
    }

    @Test
    void transactionRollsBackAllWritesOnFailure() {
        store.save(Monitor.builder("m", MonitorType.HTTP).build());

        assertThatThrownBy(() -> store.inTransaction(() -> {
            store.appendRecord(outcome("m", T0));
            store.updateCachedStatus("m", MonitorStatus.UP, T0);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.findByMonitor("m", 10)).isEmpty();
        assertThat(store.getMonitor("m").orElseThrow().lastStatus()).isNull();
    }

    @Test
    void transactionCommitsOnSuccess() {
        store.save(Monitor.builder("m", MonitorType.HTTP).build());

        String result = store.inTransaction(() -> {
            store.appendRecord(outcome("m", T0));
            store.updateCachedStatus("m", MonitorStatus.UP, T0);
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(store.findByMonitor("m", 10)).hasSize(1);
        assertThat(store.getMonitor("m").orElseThrow().lastStatus()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void deleteRemovesMonitorAndHistory() {
        store.save(Monitor.builder("m", MonitorType.HTTP).build());
        store.appendRecord(outcome("m", T0));

        assertThat(store.delete("m")).isTrue();
        assertThat(store.delete("m")).isFalse();
        assertThat(store.findByMonitor("m", 10)).isEmpty();
    }

    @Test
    void pruneUsesStrictCutoff() {
        store.appendRecord(outcome("m", T0));
        store.appendRecord(outcome("m", T0.plusSeconds(1)));

        assertThat(store.pruneOlderThan(T0.plusSeconds(1))).isEqualTo(1);
        assertThat(store.findByMonitor("m", 10)).hasSize(1);
    }

    @Test
    void deleteByMonitorCountsRows() {
        store.appendRecord(outcome("m", T0));
        store.appendRecord(outcome("m", T0.plusSeconds(1)));

        assertThat(store.deleteByMonitor("m")).isEqualTo(2);
        assertThat(store.deleteByMonitor("m")).isZero();
    }
}
