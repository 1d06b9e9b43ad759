package com.phillippitts.liveagent.service.vision.event;

import com.phillippitts.liveagent.service.vision.AttachmentOutcome;

import java.time.Instant;

/**
 * Published for every user turn of a vision-enabled session.
 */
public record SnapshotAttachmentEvent(String sessionId, AttachmentOutcome outcome, Instant at) {
}
