package com.phillippitts.liveagent.service.audio;

/**
 * PCM extracted from a container, normalized to signed little-endian samples.
 *
 * @param pcm        interleaved samples, frame aligned
 * @param sampleRate sample rate in Hz
 * @param channels   channel count as declared by the container
 * @param bitDepth   bits per sample (8, 16, 24 or 32)
 */
public record DecodedAudio(byte[] pcm, int sampleRate, int channels, int bitDepth) {

    public int frameCount() {
        return pcm.length / ((bitDepth / 8) * channels);
    }
}
