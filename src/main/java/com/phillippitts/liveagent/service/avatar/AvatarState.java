package com.phillippitts.liveagent.service.avatar;

/**
 * Avatar rendering state of one session. Moves only forward: ACTIVE, then DEGRADED, then TERMINAL.
 */
public enum AvatarState {
    /** Speech is rendered through the avatar service. */
    ACTIVE,
    /** Audio-only: the avatar is torn down and frames bypass it. */
    DEGRADED,
    /** Session teardown. */
    TERMINAL
}
