/**
 * Service layer: the monitor scheduling and execution engine.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.scheduler} - per-monitor task lifecycle and the check cycle</li>
 *   <li>{@code service.probe} - one probe runner per monitor type, dispatched by type</li>
 *   <li>{@code service.retry} - pending/down decision and next delay</li>
 *   <li>{@code service.recorder} - atomic history append plus cached status, retention pruning</li>
 *   <li>{@code service.notification} - transition detection and channel fan-out</li>
 *   <li>{@code service.monitor}, {@code service.push} - glue used by the REST API</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (not HTTP exceptions) and use constructor injection.
 */
package com.phillippitts.uptimemonitor.service;
