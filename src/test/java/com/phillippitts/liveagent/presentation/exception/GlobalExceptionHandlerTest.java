package com.phillippitts.liveagent.presentation.exception;

import com.phillippitts.liveagent.exception.ConfigurationException;
import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesSessionNotFoundReturns404() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("s-404"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("SessionNotFoundException")
                .contains("Session not found")
                .contains("s-404");
    }

    @Test
    void verifiesConfigurationErrorReturns503WithParameter() {
        ConfigurationException ex = new ConfigurationException("synthesis", "Missing required collaborator");

        ResponseEntity<?> response = handler.handleConfiguration(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("ConfigurationException")
                .contains("Invalid or missing parameter: synthesis");
    }

    @Test
    void verifiesConnectionFailureReturns503WithRetryHint() {
        ConnectionException ex = new ConnectionException("tts", 6, "Gave up: api-key=sk-secret rejected");

        ResponseEntity<?> response = handler.handleConnection(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("temporarily unavailable")
                .contains("retry")
                .doesNotContain("sk-secret");
    }

    @Test
    void verifiesUnexpectedReturns500WithoutDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Bad state in stage"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("unexpected error")
                .doesNotContain("IllegalStateException")
                .doesNotContain("Bad state");
    }

    @Test
    void verifiesErrorResponseContainsTimestamp() {
        ResponseEntity<?> response = handler.handleSessionNotFound(new SessionNotFoundException("s-1"));

        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
