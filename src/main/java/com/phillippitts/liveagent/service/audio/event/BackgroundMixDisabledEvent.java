package com.phillippitts.liveagent.service.audio.event;

import java.time.Instant;

/**
 * Published once per session when background mixing turns itself off.
 */
public record BackgroundMixDisabledEvent(String sessionId, String reason, Instant at) {
}
