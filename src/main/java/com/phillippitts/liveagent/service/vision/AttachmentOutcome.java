package com.phillippitts.liveagent.service.vision;

/**
 * What happened to the camera snapshot when a user turn was recorded.
 */
public enum AttachmentOutcome {
    ATTACHED,
    /** The attachment policy said no for this turn. */
    DECLINED,
    NO_SNAPSHOT,
    /** The latest snapshot was older than the configured max age. */
    STALE,
    ENCODE_FAILED,
    /** Vision is off for the session. */
    DISABLED
}
