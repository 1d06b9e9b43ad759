package com.phillippitts.liveagent.exception;

/** Thrown by the session admin API when no live session has the requested id. */
public class SessionNotFoundException extends LiveAgentException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No live session with id " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
