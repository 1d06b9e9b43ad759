package com.phillippitts.liveagent.domain;

import java.util.Objects;

/**
 * Lifecycle and signalling frame.
 *
 * @param sequenceId monotonic frame id
 * @param direction  flow direction
 * @param type       control kind
 * @param errorTag   {@code stage:ExceptionType} for {@link ControlType#ERROR}, otherwise {@code null}
 * @param fatal      whether the error ends the session
 */
public record ControlFrame(
        long sequenceId,
        FrameDirection direction,
        ControlType type,
        String errorTag,
        boolean fatal
) implements Frame {

    public ControlFrame {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(type, "type");
    }

    public static ControlFrame of(ControlType type) {
        return new ControlFrame(FrameSequence.next(), FrameDirection.DOWNSTREAM, type, null, false);
    }

    /** Error frames travel upstream, back toward capture. */
    public static ControlFrame error(String errorTag, boolean fatal) {
        return new ControlFrame(FrameSequence.next(), FrameDirection.UPSTREAM, ControlType.ERROR, errorTag, fatal);
    }

    public boolean is(ControlType candidate) {
        return type == candidate;
    }

    @Override
    public boolean isData() {
        return false;
    }
}
