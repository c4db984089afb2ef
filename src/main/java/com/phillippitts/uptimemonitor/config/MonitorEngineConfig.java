package com.phillippitts.uptimemonitor.config;

import com.phillippitts.uptimemonitor.config.properties.HistoryProperties;
import com.phillippitts.uptimemonitor.config.properties.MonitorSeedProperties;
import com.phillippitts.uptimemonitor.config.properties.ProbeProperties;
import com.phillippitts.uptimemonitor.config.properties.SchedulerProperties;
import com.phillippitts.uptimemonitor.service.metrics.CheckMetrics;
import com.phillippitts.uptimemonitor.service.monitor.MonitorSeeder;
import com.phillippitts.uptimemonitor.service.monitor.MonitorService;
import com.phillippitts.uptimemonitor.service.notification.LoggingNotificationChannel;
import com.phillippitts.uptimemonitor.service.notification.NotificationChannel;
import com.phillippitts.uptimemonitor.service.notification.NotificationGate;
import com.phillippitts.uptimemonitor.service.probe.ProbeDispatcher;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.database.DriverManagerConnectionFactory;
import com.phillippitts.uptimemonitor.service.probe.database.MysqlProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.http.ApacheHttpTransport;
import com.phillippitts.uptimemonitor.service.probe.http.HttpProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.http.TlsCertificateInspector;
import com.phillippitts.uptimemonitor.service.probe.icmp.DefaultProcessFactory;
import com.phillippitts.uptimemonitor.service.probe.icmp.IcmpProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.port.PortProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.push.PushProbeRunner;
import com.phillippitts.uptimemonitor.service.probe.redis.LettuceCommandClient;
import com.phillippitts.uptimemonitor.service.probe.redis.RedisProbeRunner;
import com.phillippitts.uptimemonitor.service.push.HeartbeatRegistry;
import com.phillippitts.uptimemonitor.service.push.PushService;
import com.phillippitts.uptimemonitor.service.recorder.HistoryPruner;
import com.phillippitts.uptimemonitor.service.recorder.StatusRecorder;
import com.phillippitts.uptimemonitor.service.scheduler.CheckConcurrencyGuard;
import com.phillippitts.uptimemonitor.service.scheduler.CheckCycleRunner;
import com.phillippitts.uptimemonitor.service.scheduler.MonitorScheduler;
import com.phillippitts.uptimemonitor.service.scheduler.MonitorTaskRegistry;
import com.phillippitts.uptimemonitor.service.scheduler.SchedulerLifecycle;
import com.phillippitts.uptimemonitor.service.scheduler.SpringTaskTimer;
import com.phillippitts.uptimemonitor.service.scheduler.TaskTimer;
import com.phillippitts.uptimemonitor.store.MonitorConfigStore;
import com.phillippitts.uptimemonitor.store.StatusHistoryStore;
import com.phillippitts.uptimemonitor.store.TransactionRunner;
import com.phillippitts.uptimemonitor.store.memory.InMemoryMonitorStore;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the scheduling engine: stores, probe runners, recorder, notification gate and scheduler.
 *
 * <p>Probe runners are plain beans collected by type into the {@link ProbeDispatcher}; adding a
 * monitor type means adding a runner bean here.
 */
@Configuration
public class MonitorEngineConfig {

    private static final Logger LOG = LogManager.getLogger(MonitorEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * In-memory configuration and history store, preloaded with {@code monitor.seed[n]} entries.
     */
    @Bean
    public InMemoryMonitorStore monitorStore(MonitorSeedProperties seedProperties) {
        InMemoryMonitorStore store = new InMemoryMonitorStore();
        int seeded = MonitorSeeder.seed(store, seedProperties.seed());
        LOG.info("Monitor store initialized with {} seeded monitor(s)", seeded);
        return store;
    }

    // Probe runners

    @Bean
    public HttpProbeRunner httpProbeRunner(Clock clock) {
        return new HttpProbeRunner(new ApacheHttpTransport(), new TlsCertificateInspector(), clock);
    }

    @Bean
    public PortProbeRunner portProbeRunner() {
        return new PortProbeRunner();
    }

    @Bean
    public IcmpProbeRunner icmpProbeRunner(ProbeProperties probeProperties) {
        return new IcmpProbeRunner(new DefaultProcessFactory(), probeProperties.getPingCommand());
    }

    @Bean
    public MysqlProbeRunner mysqlProbeRunner() {
        return new MysqlProbeRunner(new DriverManagerConnectionFactory());
    }

    /**
     * Netty event loops and timers shared by every Redis check, released on shutdown.
     */
    @Bean(destroyMethod = "shutdown")
    public ClientResources redisClientResources() {
        return DefaultClientResources.create();
    }

    @Bean
    public RedisProbeRunner redisProbeRunner(ClientResources redisClientResources) {
        return new RedisProbeRunner(new LettuceCommandClient(redisClientResources));
    }

    @Bean
    public PushProbeRunner pushProbeRunner(HeartbeatRegistry heartbeatRegistry, ProbeProperties probeProperties,
                                           Clock clock) {
        return new PushProbeRunner(heartbeatRegistry, probeProperties.getDefaultPushGraceSeconds(), clock);
    }

    @Bean
    public ProbeDispatcher probeDispatcher(List<ProbeRunner> runners,
                                           @Qualifier("probeExecutor") ThreadPoolTaskExecutor probeExecutor,
                                           ProbeProperties probeProperties,
                                           Clock clock) {
        return new ProbeDispatcher(runners, probeExecutor, probeProperties, clock);
    }

    // Recording and notification

    @Bean
    public StatusRecorder statusRecorder(TransactionRunner transactionRunner,
                                         StatusHistoryStore historyStore,
                                         MonitorConfigStore configStore,
                                         HistoryProperties historyProperties) {
        return new StatusRecorder(transactionRunner, historyStore, configStore, historyProperties);
    }

    @Bean
    public HistoryPruner historyPruner(StatusHistoryStore historyStore, HistoryProperties historyProperties,
                                       Clock clock) {
        return new HistoryPruner(historyStore, historyProperties, clock);
    }

    @Bean
    public LoggingNotificationChannel loggingNotificationChannel() {
        return new LoggingNotificationChannel();
    }

    @Bean
    public NotificationGate notificationGate(List<NotificationChannel> channels,
                                             @Qualifier("notificationExecutor") ThreadPoolTaskExecutor executor,
                                             CheckMetrics metrics) {
        return new NotificationGate(channels, executor, metrics);
    }

    // Scheduling

    @Bean
    public MonitorTaskRegistry monitorTaskRegistry() {
        return new MonitorTaskRegistry();
    }

    @Bean
    public TaskTimer taskTimer(@Qualifier("monitorTaskScheduler") ThreadPoolTaskScheduler taskScheduler, Clock clock) {
        return new SpringTaskTimer(taskScheduler, clock);
    }

    @Bean
    public CheckCycleRunner checkCycleRunner(ProbeDispatcher dispatcher,
                                             StatusRecorder recorder,
                                             NotificationGate notificationGate,
                                             SchedulerProperties schedulerProperties,
                                             CheckMetrics metrics,
                                             Clock clock) {
        return new CheckCycleRunner(dispatcher, recorder, notificationGate,
                new CheckConcurrencyGuard(schedulerProperties.getMaxConcurrentChecks()), metrics, clock);
    }

    @Bean
    public MonitorScheduler monitorScheduler(MonitorConfigStore configStore,
                                             MonitorTaskRegistry registry,
                                             CheckCycleRunner cycleRunner,
                                             TaskTimer taskTimer,
                                             @Qualifier("checkExecutor") ThreadPoolTaskExecutor checkExecutor,
                                             SchedulerProperties schedulerProperties,
                                             Clock clock) {
        return new MonitorScheduler(configStore, registry, cycleRunner, taskTimer, checkExecutor,
                Duration.ofSeconds(schedulerProperties.getInitialDelaySeconds()), clock);
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(MonitorConfigStore configStore,
                                                 MonitorScheduler scheduler,
                                                 MonitorTaskRegistry registry,
                                                 SchedulerProperties schedulerProperties) {
        return new SchedulerLifecycle(configStore, scheduler, registry, schedulerProperties.isEnabled());
    }

    // API services

    @Bean
    public MonitorService monitorService(MonitorConfigStore configStore,
                                         StatusHistoryStore historyStore,
                                         MonitorScheduler scheduler,
                                         HeartbeatRegistry heartbeatRegistry) {
        return new MonitorService(configStore, historyStore, scheduler, heartbeatRegistry);
    }

    @Bean
    public PushService pushService(MonitorConfigStore configStore, HeartbeatRegistry heartbeatRegistry, Clock clock) {
        return new PushService(configStore, heartbeatRegistry, clock);
    }
}
