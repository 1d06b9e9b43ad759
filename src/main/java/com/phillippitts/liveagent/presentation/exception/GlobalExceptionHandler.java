package com.phillippitts.liveagent.presentation.exception;

import com.phillippitts.liveagent.exception.ConfigurationException;
import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the session admin API.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown or already finished session (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.debug("Session not found: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Misconfiguration - the session cannot be assembled until configuration is fixed (HTTP 503).
     */
    @ExceptionHandler(ConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
        LOG.error("Session configuration invalid: parameter={}", ex.getParameter());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session cannot be configured",
                "Invalid or missing parameter: " + ex.getParameter(),
                Instant.now()
            ));
    }

    /**
     * Transient error - an external service refused connections (HTTP 503).
     */
    @ExceptionHandler(ConnectionException.class)
    ResponseEntity<ApiError> handleConnection(ConnectionException ex) {
        LOG.error("Connection failed: service={}, attempts={}", ex.getServiceName(), ex.getAttempts(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Upstream service temporarily unavailable",
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
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
