/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.UptimeMonitorException} - Base exception</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.ProbeException} - Target unreachable or
 *       assertion mismatch; drives the retry policy</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.PersistenceException} - Recording a check
 *       failed; logged, scheduling continues</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.NotificationException} - A channel could not
 *       deliver; logged, no retry</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.MonitorNotFoundException} - Monitor deleted
 *       mid-flight; the task terminates quietly</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.InvalidMonitorException} - Rejected API input</li>
 *   <li>{@link com.phillippitts.uptimemonitor.exception.PushNotAcceptedException} - Heartbeat for a paused push monitor</li>
 * </ul>
 *
 * <p>None of these escape the check run loop. At the REST boundary they map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 */
package com.phillippitts.uptimemonitor.exception;
