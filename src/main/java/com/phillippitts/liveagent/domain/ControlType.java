package com.phillippitts.liveagent.domain;

/** Kinds of {@link ControlFrame}. */
public enum ControlType {
    START,
    END,
    CANCEL,
    INTERRUPTION,
    TRANSPORT_READY,
    /** A user turn was appended to the conversation context and awaits a response. */
    TURN_READY,
    RESPONSE_START,
    RESPONSE_END,
    ERROR;

    /**
     * Lifecycle frames are forwarded by the executor itself after the stage has seen them,
     * so a stage can never swallow them.
     */
    public boolean isLifecycle() {
        return this == START || this == END || this == CANCEL || this == INTERRUPTION;
    }
}
