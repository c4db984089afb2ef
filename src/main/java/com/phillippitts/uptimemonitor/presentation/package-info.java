/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters: monitor changes go through
 * {@link com.phillippitts.uptimemonitor.service.monitor.MonitorService}, which keeps the scheduler in
 * step with the configuration store. Exception handlers map domain exceptions to HTTP status codes.
 *
 * @see com.phillippitts.uptimemonitor.presentation.controller
 * @see com.phillippitts.uptimemonitor.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.uptimemonitor.presentation;
