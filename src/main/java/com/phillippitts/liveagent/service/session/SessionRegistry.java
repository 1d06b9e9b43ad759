package com.phillippitts.liveagent.service.session;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calls currently running in this process, by session id.
 */
@Component
public class SessionRegistry {

    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();

    void register(CallSession session) {
        sessions.put(session.sessionId(), session);
    }

    void unregister(String sessionId) {
        sessions.remove(sessionId);
    }

    public Optional<CallSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<CallSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
