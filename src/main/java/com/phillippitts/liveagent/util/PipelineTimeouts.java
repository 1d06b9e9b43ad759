package com.phillippitts.liveagent.util;

import java.time.Duration;

/**
 * Standard timeout values for stage and worker lifecycle management.
 *
 * <p>Centralized so executor shutdown, blocking hand-offs and best-effort teardown use the same
 * bounds across the codebase.
 */
public final class PipelineTimeouts {

    /**
     * Poll interval for producers blocked on a full stage inbox. Bounds how long a producer keeps
     * waiting after its session has been cancelled.
     */
    public static final Duration INBOX_OFFER_POLL = Duration.ofMillis(50);

    /**
     * Poll interval of the idle-timeout watcher.
     */
    public static final Duration IDLE_CHECK_INTERVAL = Duration.ofSeconds(1);

    /**
     * Upper bound for encoding a vision snapshot before a turn falls back to text-only.
     */
    public static final Duration SNAPSHOT_ENCODE_TIMEOUT = Duration.ofSeconds(2);

    private PipelineTimeouts() {
        // Utility class - prevent instantiation
    }
}
