package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.domain.Frame;

/**
 * Emits frames from a fixed pipeline position, routed by {@link Frame#direction()}.
 *
 * <p>Pushing a downstream data frame blocks while the receiving inbox is full. Frames pushed
 * after the session ended are discarded. Safe to call from any thread.
 */
@FunctionalInterface
public interface FrameSink {

    void push(Frame frame);
}
