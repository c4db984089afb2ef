package com.phillippitts.uptimemonitor.presentation.exception;

import com.phillippitts.uptimemonitor.exception.InvalidMonitorException;
import com.phillippitts.uptimemonitor.exception.MonitorNotFoundException;
import com.phillippitts.uptimemonitor.exception.PersistenceException;
import com.phillippitts.uptimemonitor.exception.PushNotAcceptedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesMonitorNotFoundReturns404() {
        ResponseEntity<?> response = handler.handleNotFound(new MonitorNotFoundException("m1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("MonitorNotFoundException");
        assertThat(response.getBody().toString()).contains("Monitor not found");
    }

    @Test
    void verifiesInvalidMonitorReturns400WithField() {
        ResponseEntity<?> response = handler.handleInvalidMonitor(
                new InvalidMonitorException("url", "URL must start with http:// or https://"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("Invalid monitor: url");
        assertThat(response.getBody().toString()).contains("URL must start with");
    }

    @Test
    void verifiesUnreadableBodyReturns400() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", new IOException("Unexpected character"), mock(HttpInputMessage.class));

        ResponseEntity<?> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("InvalidRequestBody");
    }

    @Test
    void verifiesPushNotAcceptedReturns409() {
        ResponseEntity<?> response = handler.handlePushNotAccepted(new PushNotAcceptedException("m1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("not accepting heartbeats");
    }

    @Test
    void verifiesPersistenceFailureReturns503WithoutInternalDetails() {
        PersistenceException ex = new PersistenceException(
                "Write failed", "m1", new IllegalStateException("jdbc password: secret123"));

        ResponseEntity<?> response = handler.handlePersistence(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("retry");
        assertThat(response.getBody().toString()).doesNotContain("secret123");
    }

    @Test
    void verifiesUnexpectedReturns500WithoutStackDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("Internal error with stack trace"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("RuntimeException");
        assertThat(response.getBody().toString()).doesNotContain("stack trace");
    }

    @Test
    void verifiesErrorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleNotFound(new MonitorNotFoundException("m1"));

        assertThat(response.getBody()).isNotNull();
        String bodyStr = response.getBody().toString();
        assertThat(bodyStr).contains("errorCode=");
        assertThat(bodyStr).contains("message=");
        assertThat(bodyStr).contains("details=");
        assertThat(bodyStr).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
