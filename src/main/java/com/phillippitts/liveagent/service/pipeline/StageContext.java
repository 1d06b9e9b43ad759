package com.phillippitts.liveagent.service.pipeline;

import java.util.concurrent.Executor;

/**
 * Services the executor offers to a running stage.
 */
public interface StageContext {

    String sessionId();

    /**
     * Sink positioned at this stage, for frames produced by the stage's own background tasks.
     */
    FrameSink output();

    /**
     * Executor for long-running background tasks such as stream readers.
     */
    Executor taskExecutor();

    /**
     * Reports a failure raised outside {@link Stage#process}, typically by a background task.
     * Handled with the same policy as a failure inside {@code process}.
     */
    void reportError(Throwable error);

    /**
     * Resets the session idle timer.
     */
    void markActivity();

    /**
     * {@code false} once the session is ending; background loops use it as their exit condition.
     */
    boolean isActive();
}
