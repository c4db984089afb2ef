/**
 * Per-monitor recurring check tasks.
 *
 * <p>{@link com.phillippitts.uptimemonitor.service.scheduler.MonitorScheduler} is the entry point
 * ({@code schedule}/{@code stop}); {@link com.phillippitts.uptimemonitor.service.scheduler.MonitorTaskRegistry}
 * holds the live tasks; {@link com.phillippitts.uptimemonitor.service.scheduler.CheckCycleRunner} runs
 * one probe, retry, record and notify sequence.
 */
package com.phillippitts.uptimemonitor.service.scheduler;
