package com.phillippitts.liveagent.service.recognition;

import java.util.Objects;

/**
 * Output of a streaming recognizer.
 *
 * @param type kind of event
 * @param text transcript for {@code PARTIAL} and {@code FINAL}, empty otherwise
 */
public record RecognitionEvent(Type type, String text) {

    public enum Type {
        /** Voice activity began; the participant may be talking over the bot. */
        SPEECH_STARTED,
        PARTIAL,
        FINAL
    }

    public RecognitionEvent {
        Objects.requireNonNull(type, "type");
        text = text == null ? "" : text;
    }

    public static RecognitionEvent speechStarted() {
        return new RecognitionEvent(Type.SPEECH_STARTED, "");
    }

    public static RecognitionEvent partial(String text) {
        return new RecognitionEvent(Type.PARTIAL, text);
    }

    public static RecognitionEvent finalTranscript(String text) {
        return new RecognitionEvent(Type.FINAL, text);
    }
}
