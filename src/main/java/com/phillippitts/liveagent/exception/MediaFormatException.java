package com.phillippitts.liveagent.exception;

/**
 * Thrown when raw media cannot be decoded, converted or mixed.
 * Fatal only for the operation that raised it; the enclosing feature disables itself.
 */
public class MediaFormatException extends LiveAgentException {

    public MediaFormatException(String message) {
        super(message);
    }

    public MediaFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
