package com.phillippitts.liveagent.exception;

/**
 * Thrown when a streaming external service cannot be connected.
 *
 * <p>Retryable while a {@code ResilientConnection} still has attempts left; once attempts are
 * exhausted it is fatal for that service only.
 */
public class ConnectionException extends LiveAgentException {

    private final String serviceName;
    private final int attempts;

    public ConnectionException(String serviceName, int attempts, String message) {
        super(message + " (service: " + serviceName + ", attempts: " + attempts + ")");
        this.serviceName = serviceName;
        this.attempts = attempts;
    }

    public ConnectionException(String serviceName, int attempts, String message, Throwable cause) {
        super(message + " (service: " + serviceName + ", attempts: " + attempts + ")", cause);
        this.serviceName = serviceName;
        this.attempts = attempts;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getAttempts() {
        return attempts;
    }
}
