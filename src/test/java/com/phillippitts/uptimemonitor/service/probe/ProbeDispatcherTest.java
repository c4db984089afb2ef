package com.phillippitts.uptimemonitor.service.probe;

import com.phillippitts.uptimemonitor.config.properties.ProbeProperties;
import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorStatus;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.testutil.MutableClock;
import com.phillippitts.uptimemonitor.testutil.ScriptedProbeRunner;
import com.phillippitts.uptimemonitor.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProbeDispatcherTest {

    private final AsyncTaskExecutor sync = new TaskExecutorAdapter(new SyncExecutor());
    private ThreadPoolTaskExecutor pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private static Monitor monitor(MonitorType type) {
        return Monitor.builder("m", type).build();
    }

    @Test
    void delegatesToRunnerForType() {
        ScriptedProbeRunner port = new ScriptedProbeRunner(MonitorType.PORT).thenUp();
        ProbeDispatcher dispatcher = new ProbeDispatcher(List.of(port), sync, new ProbeProperties());

        CheckOutcome outcome = dispatcher.probe(monitor(MonitorType.PORT));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.UP);
        assertThat(port.invocations()).isEqualTo(1);
        assertThat(dispatcher.supports(MonitorType.PORT)).isTrue();
        assertThat(dispatcher.supports(MonitorType.REDIS)).isFalse();
    }

    @Test
    void outcomesCarryTheEngineClockTime() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        ProbeDispatcher dispatcher = new ProbeDispatcher(
                List.of(new ScriptedProbeRunner(MonitorType.PORT).thenUp()), sync, new ProbeProperties(), clock);

        clock.advance(Duration.ofMinutes(3));
        CheckOutcome checked = dispatcher.probe(monitor(MonitorType.PORT));
        CheckOutcome unsupported = dispatcher.probe(monitor(MonitorType.REDIS));

        assertThat(checked.timestamp()).isEqualTo(Instant.parse("2024-05-01T08:03:00Z"));
        assertThat(unsupported.timestamp()).isEqualTo(Instant.parse("2024-05-01T08:03:00Z"));
    }

    @Test
    void probeExceptionBecomesDownWithItsMessage() {
        ProbeDispatcher dispatcher = new ProbeDispatcher(
                List.of(new ScriptedProbeRunner(MonitorType.PORT).thenDown()), sync, new ProbeProperties());

        CheckOutcome outcome = dispatcher.probe(monitor(MonitorType.PORT));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).isEqualTo("Connection refused");
    }

    @Test
    void unexpectedExceptionBecomesDown() {
        ProbeRunner buggy = new ProbeRunner() {
            @Override
            public Set<MonitorType> supportedTypes() {
                return Set.of(MonitorType.HTTP);
            }

            @Override
            public CheckOutcome run(Monitor monitor, Duration timeout) {
                throw new NullPointerException("header missing");
            }
        };
        ProbeDispatcher dispatcher = new ProbeDispatcher(List.of(buggy), sync, new ProbeProperties());

        CheckOutcome outcome = dispatcher.probe(monitor(MonitorType.HTTP));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).isEqualTo("NullPointerException: header missing");
    }

    @Test
    void missingRunnerIsDown() {
        ProbeDispatcher dispatcher = new ProbeDispatcher(List.of(), sync, new ProbeProperties());

        CheckOutcome outcome = dispatcher.probe(monitor(MonitorType.ICMP));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).isEqualTo("No probe available for type icmp");
    }

    @Test
    void upsideDownInvertsBothWays() {
        ProbeDispatcher dispatcher = new ProbeDispatcher(
                List.of(new ScriptedProbeRunner(MonitorType.PORT).thenUp().thenDown()), sync, new ProbeProperties());
        Monitor inverted = monitor(MonitorType.PORT).toBuilder().upsideDown(true).build();

        assertThat(dispatcher.probe(inverted).status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(dispatcher.probe(inverted).status()).isEqualTo(MonitorStatus.UP);
    }

    @Test
    void duplicateRunnerForTypeIsRejected() {
        assertThatThrownBy(() -> new ProbeDispatcher(List.of(
                new ScriptedProbeRunner(MonitorType.PORT), new ScriptedProbeRunner(MonitorType.PORT)),
                sync, new ProbeProperties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("port");
    }

    @Test
    void rejectedSubmissionIsDown() {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        when(saturated.submit(any(Callable.class))).thenThrow(new TaskRejectedException("full"));
        ProbeDispatcher dispatcher = new ProbeDispatcher(
                List.of(new ScriptedProbeRunner(MonitorType.PORT)), saturated, new ProbeProperties());

        CheckOutcome outcome = dispatcher.probe(monitor(MonitorType.PORT));

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).contains("saturated");
    }

    @Test
    void hungProbeTimesOutAndIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        ProbeRunner hanging = new ProbeRunner() {
            @Override
            public Set<MonitorType> supportedTypes() {
                return Set.of(MonitorType.PORT);
            }

            @Override
            public CheckOutcome run(Monitor monitor, Duration timeout) {
                try {
                    Thread.sleep(30_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return CheckOutcome.up(monitor.id(), "too late", null);
            }
        };
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.initialize();
        ProbeProperties properties = new ProbeProperties();
        properties.setTimeoutSlackMillis(100);
        ProbeDispatcher dispatcher = new ProbeDispatcher(List.of(hanging), pool, properties);
        Monitor monitor = monitor(MonitorType.PORT).toBuilder()
                .config(MonitorConfig.builder().connectTimeout(1).build()).build();

        long start = System.nanoTime();
        CheckOutcome outcome = dispatcher.probe(monitor);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(outcome.status()).isEqualTo(MonitorStatus.DOWN);
        assertThat(outcome.message()).isEqualTo("Timeout after 1s");
        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
