package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.domain.Frame;

/**
 * One processing step of a pipeline.
 *
 * <p>The executor runs each stage on its own task and calls {@link #process} with one frame at a
 * time, in arrival order. A stage emits zero or more frames through the given sink; frames pushed
 * downstream block while the next stage's inbox is full.
 *
 * <p>Lifecycle frames ({@code START}, {@code END}, {@code CANCEL}, {@code INTERRUPTION}) are shown
 * to the stage and then forwarded by the executor, so {@code process} must not push them itself.
 * Every other frame a stage does not consume has to be pushed on explicitly.
 */
public interface Stage {

    String name();

    /**
     * Called once on the stage task before the first frame.
     */
    default void open(StageContext context) {
    }

    /**
     * Handles one frame.
     *
     * @throws Exception any failure; the executor converts it into an error control frame
     */
    void process(Frame frame, FrameSink sink) throws Exception;

    /**
     * Out-of-band interruption notice, delivered on the interrupting thread before the
     * interruption frame is queued. Implementations stop in-flight synthesis or rendering and
     * must be thread-safe.
     */
    default void onInterruption() {
    }

    /**
     * Releases stage resources. Called once on the stage task after END or CANCEL.
     */
    default void close() {
    }
}
