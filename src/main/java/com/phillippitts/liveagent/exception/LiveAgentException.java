package com.phillippitts.liveagent.exception;

/**
 * Base exception for all live-agent errors.
 * Every domain exception extends this class so stage boundaries and the REST layer can
 * map failures to a specific recovery action.
 */
public class LiveAgentException extends RuntimeException {

    public LiveAgentException(String message) {
        super(message);
    }

    public LiveAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    public LiveAgentException(Throwable cause) {
        super(cause);
    }
}
