package com.phillippitts.liveagent.domain;

/**
 * A typed unit of media or control data flowing through the pipeline.
 *
 * <p>Implementations are immutable records. Sequence ids come from {@link FrameSequence} and
 * increase monotonically for the lifetime of the process.
 */
public interface Frame {

    long sequenceId();

    FrameDirection direction();

    /** Data frames are subject to inbox capacity and interruption; control frames are not. */
    default boolean isData() {
        return true;
    }
}
