package com.phillippitts.liveagent.service.text;

import java.util.Optional;

/**
 * Accumulates streamed model tokens and releases speakable chunks.
 *
 * <p>A chunk ends at the last sentence boundary ({@code . ! ? \n}) seen so far. If the buffer
 * grows past {@code maxChars} without one, everything buffered is released. Chunks are returned
 * as accumulated, without trimming. Not thread-safe.
 */
public final class TextFlushBuffer {

    public static final int DEFAULT_MAX_CHARS = 400;

    private final int maxChars;
    private final StringBuilder buffer = new StringBuilder();

    public TextFlushBuffer() {
        this(DEFAULT_MAX_CHARS);
    }

    public TextFlushBuffer(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive, got: " + maxChars);
        }
        this.maxChars = maxChars;
    }

    /**
     * Appends a token and returns a chunk if one is ready.
     */
    public Optional<String> append(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        buffer.append(token);
        int boundary = lastBoundary();
        if (boundary >= 0) {
            String chunk = buffer.substring(0, boundary + 1);
            buffer.delete(0, boundary + 1);
            return Optional.of(chunk);
        }
        if (buffer.length() > maxChars) {
            return flush();
        }
        return Optional.empty();
    }

    /**
     * Releases whatever is buffered, typically at end of turn.
     */
    public Optional<String> flush() {
        if (buffer.length() == 0) {
            return Optional.empty();
        }
        String rest = buffer.toString();
        buffer.setLength(0);
        return Optional.of(rest);
    }

    /** Drops buffered text without emitting it. */
    public void clear() {
        buffer.setLength(0);
    }

    public boolean isEmpty() {
        return buffer.length() == 0;
    }

    private int lastBoundary() {
        for (int i = buffer.length() - 1; i >= 0; i--) {
            char c = buffer.charAt(i);
            if (c == '.' || c == '!' || c == '?' || c == '\n') {
                return i;
            }
        }
        return -1;
    }
}
