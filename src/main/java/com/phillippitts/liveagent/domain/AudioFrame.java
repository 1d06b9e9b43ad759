package com.phillippitts.liveagent.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw little-endian 16-bit PCM audio.
 *
 * <p>The frame takes ownership of {@code pcm}: producers hand over a fresh array and never touch it
 * again, and consumers treat {@link #pcm()} as read-only. Mixing produces a new frame through
 * {@link #withPcm(byte[])} that keeps the sequence id, byte length and sample count. Equality
 * compares sample content.
 *
 * @param sequenceId monotonic frame id
 * @param direction  flow direction
 * @param pcm        interleaved PCM16LE samples
 * @param sampleRate sample rate in Hz
 * @param channels   channel count
 * @param numSamples samples per channel
 */
public record AudioFrame(
        long sequenceId,
        FrameDirection direction,
        byte[] pcm,
        int sampleRate,
        int channels,
        int numSamples
) implements Frame {

    private static final int BYTES_PER_SAMPLE = 2;

    public AudioFrame {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(pcm, "pcm");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
    }

    /**
     * Creates a downstream frame with the next sequence id.
     */
    public static AudioFrame of(byte[] pcm, int sampleRate, int channels) {
        return new AudioFrame(FrameSequence.next(), FrameDirection.DOWNSTREAM, pcm, sampleRate, channels,
                pcm.length / (BYTES_PER_SAMPLE * channels));
    }

    /**
     * Returns a frame with the same identity and shape carrying different sample data.
     *
     * @throws IllegalArgumentException if {@code replacement} has a different length
     */
    public AudioFrame withPcm(byte[] replacement) {
        if (replacement.length != pcm.length) {
            throw new IllegalArgumentException("Replacement PCM must keep frame length "
                    + pcm.length + ", got: " + replacement.length);
        }
        return new AudioFrame(sequenceId, direction, replacement, sampleRate, channels, numSamples);
    }

    public long durationMillis() {
        return numSamples * 1000L / sampleRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return sequenceId == other.sequenceId
                && sampleRate == other.sampleRate
                && channels == other.channels
                && numSamples == other.numSamples
                && direction == other.direction
                && Arrays.equals(pcm, other.pcm);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(sequenceId, direction, sampleRate, channels, numSamples) + Arrays.hashCode(pcm);
    }

    @Override
    public String toString() {
        return "AudioFrame[id=" + sequenceId + ", bytes=" + pcm.length + ", rate=" + sampleRate
                + ", channels=" + channels + ']';
    }
}
