package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.exception.MediaFormatException;

/**
 * Additive mixing of a looping background track under speech.
 *
 * <p>The background is scaled by {@code gain} in the 16-bit domain and added with saturation.
 * The output frame keeps the input's sequence id, byte length and sample count.
 */
public final class AudioMixer {

    private AudioMixer() {
        // Utility class
    }

    /**
     * @param speech mono PCM16 frame at the track's sample rate
     * @param track  background read head; advanced by the frame length
     * @param gain   linear gain; {@code <= 0} returns {@code speech} untouched and leaves the cursor
     * @throws MediaFormatException if the frame is not mono or its rate differs from the track
     */
    public static AudioFrame mix(AudioFrame speech, BackgroundTrack track, double gain) {
        if (gain <= 0.0) {
            return speech;
        }
        if (speech.channels() != PcmFormat.MONO) {
            throw new MediaFormatException("Background mixing needs mono speech, got " + speech.channels()
                    + " channels");
        }
        if (speech.sampleRate() != track.sampleRate()) {
            throw new MediaFormatException("Speech rate " + speech.sampleRate() + " Hz does not match track rate "
                    + track.sampleRate() + " Hz");
        }
        byte[] voice = speech.pcm();
        int n = voice.length;
        if (n == 0) {
            return speech;
        }
        byte[] bed = track.next(n);
        byte[] out = new byte[n];
        int aligned = n - (n % PcmFormat.BYTES_PER_SAMPLE);
        for (int i = 0; i < aligned; i += PcmFormat.BYTES_PER_SAMPLE) {
            int s = (voice[i] & 0xFF) | (voice[i + 1] << 8);
            int b = (int) (((bed[i] & 0xFF) | (bed[i + 1] << 8)) * gain);
            PcmFormatConverter.writeSample(out, i, s + b);
        }
        if (aligned < n) {
            out[n - 1] = voice[n - 1];
        }
        return speech.withPcm(out);
    }
}
