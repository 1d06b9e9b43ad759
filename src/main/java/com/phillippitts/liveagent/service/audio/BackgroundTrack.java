package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.exception.MediaFormatException;

import java.util.Objects;

/**
 * A looping read head over shared, decoded background PCM.
 *
 * <p>The PCM array is shared across sessions and never written. The cursor is private to this
 * instance, so each mixer gets its own track. Not thread-safe; owned by one stage task.
 */
public final class BackgroundTrack {

    private final byte[] pcm;
    private final int length;
    private final int sampleRate;
    private int cursor;

    /**
     * @param sharedPcm  16-bit mono samples at {@code sampleRate}
     * @param sampleRate rate the PCM was converted to
     * @throws MediaFormatException if the PCM holds no whole sample
     */
    public BackgroundTrack(byte[] sharedPcm, int sampleRate) {
        this.pcm = Objects.requireNonNull(sharedPcm, "sharedPcm");
        this.length = sharedPcm.length - (sharedPcm.length % PcmFormat.BYTES_PER_SAMPLE);
        if (length == 0) {
            throw new MediaFormatException("Background track is empty");
        }
        this.sampleRate = sampleRate;
    }

    /**
     * Returns the next {@code n} bytes, wrapping to the start as often as needed.
     * The cursor advances by {@code n mod length}.
     */
    public byte[] next(int n) {
        byte[] out = new byte[n];
        int written = 0;
        while (written < n) {
            int chunk = Math.min(n - written, length - cursor);
            System.arraycopy(pcm, cursor, out, written, chunk);
            written += chunk;
            cursor = (cursor + chunk) % length;
        }
        return out;
    }

    public int cursor() {
        return cursor;
    }

    public int length() {
        return length;
    }

    public int sampleRate() {
        return sampleRate;
    }
}
