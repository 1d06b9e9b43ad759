package com.phillippitts.liveagent.domain;

import java.util.Objects;

/**
 * A piece of conversational text.
 *
 * @param sequenceId monotonic frame id
 * @param direction  flow direction
 * @param text       text content (may be a single streamed token)
 * @param finalText  {@code true} for final transcripts; partial transcripts and streamed
 *                   model tokens are not final
 * @param speaker    who produced the text
 */
public record TextFrame(
        long sequenceId,
        FrameDirection direction,
        String text,
        boolean finalText,
        Speaker speaker
) implements Frame {

    /** Origin of the text. */
    public enum Speaker { USER, ASSISTANT }

    public TextFrame {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(speaker, "speaker");
    }

    public static TextFrame transcript(String text, boolean finalText) {
        return new TextFrame(FrameSequence.next(), FrameDirection.DOWNSTREAM, text, finalText, Speaker.USER);
    }

    public static TextFrame assistant(String text) {
        return new TextFrame(FrameSequence.next(), FrameDirection.DOWNSTREAM, text, false, Speaker.ASSISTANT);
    }
}
