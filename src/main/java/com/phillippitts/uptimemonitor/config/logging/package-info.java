/**
 * Logging infrastructure: request-scoped MDC for the REST API. Check cycles add their own
 * {@code monitorId}/{@code monitorType} keys in the scheduler.
 */
package com.phillippitts.uptimemonitor.config.logging;
