package com.phillippitts.liveagent.service.pipeline;

/** Status of a pipeline session. Everything except {@link #RUNNING} is terminal. */
public enum PipelineStatus {
    RUNNING,
    /** END travelled through every stage. */
    COMPLETED,
    CANCELLED,
    /** A fatal stage failure ended the session. */
    FAILED,
    IDLE_TIMEOUT;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
