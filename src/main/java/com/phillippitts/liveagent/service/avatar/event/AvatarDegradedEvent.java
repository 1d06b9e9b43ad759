package com.phillippitts.liveagent.service.avatar.event;

import java.time.Instant;

/**
 * Published once when a session's avatar falls back to audio-only.
 */
public record AvatarDegradedEvent(String sessionId, String service, String reason, Instant at) {
}
