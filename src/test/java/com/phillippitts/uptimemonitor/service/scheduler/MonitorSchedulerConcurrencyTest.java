package com.phillippitts.uptimemonitor.service.scheduler;

import com.phillippitts.uptimemonitor.config.properties.HistoryProperties;
import com.phillippitts.uptimemonitor.config.properties.ProbeProperties;
import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.service.metrics.CheckMetrics;
import com.phillippitts.uptimemonitor.service.notification.NotificationGate;
import com.phillippitts.uptimemonitor.service.probe.ProbeDispatcher;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.service.recorder.StatusRecorder;
import com.phillippitts.uptimemonitor.store.memory.InMemoryMonitorStore;
import com.phillippitts.uptimemonitor.testutil.ManualTaskTimer;
import com.phillippitts.uptimemonitor.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Exercises the scheduler with real threads: per-monitor mutual exclusion and schedule/stop races.
 */
class MonitorSchedulerConcurrencyTest {

    private static final String ID = "m1";

    private final CountDownLatch firstEntered = new CountDownLatch(1);
    private final CountDownLatch releaseFirst = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private InMemoryMonitorStore store;
    private ManualTaskTimer timer;
    private MonitorTaskRegistry registry;
    private ExecutorService checkPool;
    private MonitorScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryMonitorStore();
        timer = new ManualTaskTimer();
        registry = new MonitorTaskRegistry();
        checkPool = Executors.newFixedThreadPool(4);

        CheckMetrics metrics = new CheckMetrics(new SimpleMeterRegistry());
        ProbeDispatcher dispatcher = new ProbeDispatcher(List.of(new BlockingFirstProbe()),
                new TaskExecutorAdapter(new SyncExecutor()), new ProbeProperties());
        CheckCycleRunner cycle = new CheckCycleRunner(dispatcher,
                new StatusRecorder(store, store, store, new HistoryProperties()),
                new NotificationGate(List.of(), new SyncExecutor(), metrics),
                CheckConcurrencyGuard.unlimited(), metrics, Clock.systemUTC());
        scheduler = new MonitorScheduler(store, registry, cycle, timer, checkPool, Duration.ZERO, Clock.systemUTC());

        store.save(Monitor.builder(ID, MonitorType.PORT)
                .config(MonitorConfig.builder().hostname("localhost").port(1).build())
                .build());
    }

    @AfterEach
    void tearDown() {
        releaseFirst.countDown();
        checkPool.shutdownNow();
    }

    @Test
    void replacedTaskWaitsForInFlightCycleOfSameMonitor() throws Exception {
        scheduler.schedule(ID);
        timer.fireNext();
        assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

        // Reschedule while the first cycle is still probing, then fire the new task at once
        scheduler.schedule(ID);
        timer.fireNext();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2))
                .until(() -> calls.get() == 1);

        releaseFirst.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() == 2);
        await().atMost(Duration.ofSeconds(5)).until(() -> timer.pendingCount() == 1);

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void concurrentScheduleAndStopNeverLeaveTwoLiveTimers() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(callers.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        if (ThreadLocalRandom.current().nextBoolean()) {
                            scheduler.schedule(ID);
                        } else {
                            scheduler.stop(ID);
                        }
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(registry.size()).isLessThanOrEqualTo(1);
        assertThat(timer.pendingCount()).isEqualTo(registry.size());
    }

    private final class BlockingFirstProbe implements ProbeRunner {

        @Override
        public Set<MonitorType> supportedTypes() {
            return Set.of(MonitorType.PORT);
        }

        @Override
        public CheckOutcome run(Monitor monitor, Duration timeout) {
            int call = calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                if (call == 1) {
                    firstEntered.countDown();
                    releaseFirst.await(5, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return CheckOutcome.up(monitor.id(), "OK", 1L);
        }
    }
}
