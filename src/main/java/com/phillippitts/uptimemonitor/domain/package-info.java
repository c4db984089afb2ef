/**
 * Domain models for monitors and their check results.
 *
 * <p>All types are immutable records or enums validated on construction:
 * <ul>
 *   <li>{@link com.phillippitts.uptimemonitor.domain.Monitor} - a check definition and its cached status</li>
 *   <li>{@link com.phillippitts.uptimemonitor.domain.MonitorConfig} - type-specific settings</li>
 *   <li>{@link com.phillippitts.uptimemonitor.domain.CheckOutcome} - result of one probe</li>
 *   <li>{@link com.phillippitts.uptimemonitor.domain.StatusRecord} - persisted history row</li>
 * </ul>
 */
package com.phillippitts.uptimemonitor.domain;
