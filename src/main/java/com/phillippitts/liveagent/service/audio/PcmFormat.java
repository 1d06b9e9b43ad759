package com.phillippitts.liveagent.service.audio;

/**
 * Constants for the pipeline's raw-audio currency: 16-bit signed little-endian PCM.
 */
public final class PcmFormat {

    /** Bytes per 16-bit sample. */
    public static final int BYTES_PER_SAMPLE = 2;

    /** Default sample rate for transport audio in Hz. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;

    public static final int MONO = 1;
    public static final int STEREO = 2;

    private PcmFormat() {}

    /**
     * Largest prefix of {@code length} bytes that holds whole frames.
     */
    public static int alignedLength(int length, int bytesPerSample, int channels) {
        int frameSize = bytesPerSample * channels;
        return length - (length % frameSize);
    }
}
