package com.phillippitts.liveagent.service.vision;

/**
 * When a camera snapshot is attached to a user turn.
 */
public enum AttachMode {
    /** Whenever a fresh snapshot exists. */
    ALWAYS,
    NEVER,
    /** Only when the turn text refers to something visual. */
    AUTO
}
