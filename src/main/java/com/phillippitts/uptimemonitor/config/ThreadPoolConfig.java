package com.phillippitts.uptimemonitor.config;

import com.phillippitts.uptimemonitor.config.properties.SchedulerProperties;
import com.phillippitts.uptimemonitor.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by the scheduling engine.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the number of monitors and their intervals.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final SchedulerProperties schedulerProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, SchedulerProperties schedulerProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.schedulerProperties = schedulerProperties;
    }

    /**
     * Pool that runs whole check cycles (probe, retry policy, record, notify).
     *
     * <p>Direct hand-off, aborting when every thread is busy: the scheduler skips that cycle and
     * re-arms the monitor one interval later, so the timer thread never runs a cycle itself.
     *
     * @return executor for check cycles
     */
    @Bean(name = "checkExecutor")
    public ThreadPoolTaskExecutor checkExecutor() {
        return buildExecutor(threadPoolProperties.getCheck());
    }

    /**
     * Pool that runs the probe call of a cycle. The cycle waits on the probe with a hard timeout and
     * abandons (interrupts) it when the timeout elapses.
     *
     * <p>Aborts when saturated, which the dispatcher reports as a DOWN outcome. Running the probe on
     * the cycle thread instead would bypass the hard timeout.
     *
     * @return executor for probe calls
     */
    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor() {
        return buildExecutor(threadPoolProperties.getProbe());
    }

    /**
     * Pool for fire-and-forget notification delivery, so a slow channel never delays the next check.
     *
     * @return executor for notification channels
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        return buildExecutor(threadPoolProperties.getNotification());
    }

    /**
     * Timer used to arm single-shot check cycles and to run {@code @Scheduled} maintenance jobs.
     *
     * @return task scheduler
     */
    @Bean(name = "monitorTaskScheduler")
    public ThreadPoolTaskScheduler monitorTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerProperties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("monitor-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler(props.getRejectionPolicy()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static RejectedExecutionHandler rejectionHandler(ThreadPoolProperties.RejectionPolicy policy) {
        if (policy == ThreadPoolProperties.RejectionPolicy.ABORT) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread to the worker thread and restores the
     * worker's own context afterwards.
     */
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
