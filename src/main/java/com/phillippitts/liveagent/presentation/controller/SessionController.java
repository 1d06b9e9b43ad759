package com.phillippitts.liveagent.presentation.controller;

import com.phillippitts.liveagent.service.avatar.AvatarState;
import com.phillippitts.liveagent.service.session.CallSession;
import com.phillippitts.liveagent.service.session.CallSessionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Admin view of live calls: list, inspect and stop.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final CallSessionService sessions;

    SessionController(CallSessionService sessions) {
        this.sessions = sessions;
    }

    @GetMapping
    ResponseEntity<List<SessionView>> list() {
        List<SessionView> views = sessions.activeSessions().stream()
                .sorted(Comparator.comparing(CallSession::startedAt))
                .map(SessionView::of)
                .collect(Collectors.toList());
        return ResponseEntity.ok(views);
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<SessionView> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionView.of(sessions.find(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    ResponseEntity<SessionView> stop(@PathVariable String sessionId) {
        LOG.info("Stop requested for session {}", sessionId);
        return ResponseEntity.accepted().body(SessionView.of(sessions.stop(sessionId)));
    }

    record SessionView(
            String sessionId,
            String callId,
            String status,
            Instant startedAt,
            long elapsedSeconds,
            AvatarState avatarState
    ) {
        static SessionView of(CallSession session) {
            return new SessionView(
                    session.sessionId(),
                    session.callId(),
                    session.task().status().name(),
                    session.startedAt(),
                    session.task().elapsed().toSeconds(),
                    session.avatarState().orElse(null));
        }
    }
}
