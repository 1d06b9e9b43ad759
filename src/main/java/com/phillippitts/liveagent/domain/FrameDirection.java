package com.phillippitts.liveagent.domain;

/**
 * Flow direction relative to stage order.
 *
 * <p>{@link #DOWNSTREAM} follows the pipeline order (capture toward output, so participant
 * media travels toward the model and bot speech travels toward the participant).
 * {@link #UPSTREAM} travels back toward capture and carries acknowledgements and error tags.
 */
public enum FrameDirection {
    DOWNSTREAM,
    UPSTREAM
}
