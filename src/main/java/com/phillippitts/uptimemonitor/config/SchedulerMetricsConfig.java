package com.phillippitts.uptimemonitor.config;

import com.phillippitts.uptimemonitor.service.scheduler.MonitorTaskRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes scheduler and check pool metrics via Micrometer.
 *
 * <ul>
 *   <li>uptime.scheduler.tasks - Live scheduled monitor tasks</li>
 *   <li>check.pool.size / active / queued / completed - Check cycle pool</li>
 *   <li>probe.pool.active / queued - Probe pool</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class SchedulerMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(SchedulerMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> checkExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider;
    private final ObjectProvider<MonitorTaskRegistry> registryProvider;

    public SchedulerMetricsConfig(
            @Qualifier("checkExecutor") ObjectProvider<ThreadPoolTaskExecutor> checkExecutorProvider,
            @Qualifier("probeExecutor") ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider,
            ObjectProvider<MonitorTaskRegistry> registryProvider) {
        this.checkExecutorProvider = checkExecutorProvider;
        this.probeExecutorProvider = probeExecutorProvider;
        this.registryProvider = registryProvider;
    }

    /**
     * Binds scheduler and pool gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder schedulerMetrics() {
        return registry -> {
            MonitorTaskRegistry tasks = registryProvider.getObject();
            Gauge.builder("uptime.scheduler.tasks", tasks, MonitorTaskRegistry::size)
                    .description("Number of monitors with a live scheduled task")
                    .register(registry);

            bindPool(registry, "check.pool", checkExecutorProvider.getObject().getThreadPoolExecutor());
            bindPool(registry, "probe.pool", probeExecutorProvider.getObject().getThreadPoolExecutor());

            LOG.info("Scheduler metrics registered: uptime.scheduler.tasks, check.pool.*, probe.pool.*");
        };
    }

    private static void bindPool(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .register(registry);
    }

    /**
     * Logs scheduler and pool health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logSchedulerHealth() {
        ThreadPoolExecutor check = checkExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor probe = probeExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Scheduler Health: tasks={}, check pool size={}/{} active={} queued={}, "
                        + "probe pool active={} queued={}",
                registryProvider.getObject().size(),
                check.getPoolSize(),
                check.getMaximumPoolSize(),
                check.getActiveCount(),
                check.getQueue().size(),
                probe.getActiveCount(),
                probe.getQueue().size());
    }
}
