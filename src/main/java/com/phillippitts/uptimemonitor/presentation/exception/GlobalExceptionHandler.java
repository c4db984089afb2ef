package com.phillippitts.uptimemonitor.presentation.exception;

import com.phillippitts.uptimemonitor.exception.InvalidMonitorException;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.exception.PersistenceException;
import com.phillippitts.uptimemonitor.exception.PushNotAcceptedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown monitor id or push token (HTTP 404).
     */
    @ExceptionHandler(MonitorNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(MonitorNotFoundException ex) {
        LOG.debug("Monitor not found: {}", ex.getMonitorId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Monitor not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid monitor definition (HTTP 400).
     */
    @ExceptionHandler(InvalidMonitorException.class)
    ResponseEntity<ApiError> handleInvalidMonitor(InvalidMonitorException ex) {
        LOG.warn("Invalid monitor: field={}, reason={}", ex.getField(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid monitor: " + ex.getField(),
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - body missing or not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequestBody",
                "Request body could not be read",
                "Send a JSON object",
                Instant.now()
            ));
    }

    /**
     * Heartbeat for a paused push monitor (HTTP 409).
     */
    @ExceptionHandler(PushNotAcceptedException.class)
    ResponseEntity<ApiError> handlePushNotAccepted(PushNotAcceptedException ex) {
        LOG.info("Heartbeat rejected for inactive monitor {}", ex.getMonitorId());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Monitor is not accepting heartbeats",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient storage error - retry possible (HTTP 503).
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        LOG.error("Persistence failed: monitor={}", ex.getMonitorId(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Storage temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
