package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.exception.MediaFormatException;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Stateless conversions between PCM representations.
 *
 * <p>Every output is frame aligned: trailing partial samples are truncated so the length is a
 * multiple of sample width times channel count.
 *
 * <p><b>Resampling:</b> linear interpolation between neighbouring samples. Output length is
 * {@code floor(inputSamples * dstRate / srcRate)}, which keeps duration within one sample period.
 */
public final class PcmFormatConverter {

    private static final int MAX_BIT_DEPTH = 32;

    private PcmFormatConverter() {
        // Utility class
    }

    /**
     * Decodes a WAV (or other Java Sound supported) container into linear PCM.
     *
     * @throws MediaFormatException if the container is unreadable, uses an unsupported encoding,
     *                              or holds zero audio frames
     */
    public static DecodedAudio decodeContainer(byte[] container) {
        if (container == null || container.length == 0) {
            throw new MediaFormatException("Audio container is empty");
        }
        try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(container))) {
            AudioFormat format = in.getFormat();
            AudioInputStream source = in;
            if (!isLinearPcm(format.getEncoding())) {
                AudioFormat target = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, format.getSampleRate(), 16,
                        format.getChannels(), format.getChannels() * 2, format.getSampleRate(), false);
                if (!AudioSystem.isConversionSupported(target, format)) {
                    throw new MediaFormatException("Unsupported audio encoding: " + format.getEncoding());
                }
                source = AudioSystem.getAudioInputStream(target, in);
                format = target;
            }

            int bitDepth = format.getSampleSizeInBits();
            int channels = format.getChannels();
            if (bitDepth < 8 || bitDepth > MAX_BIT_DEPTH || bitDepth % 8 != 0) {
                throw new MediaFormatException("Unsupported bit depth: " + bitDepth);
            }
            if (channels <= 0) {
                throw new MediaFormatException("Invalid channel count: " + channels);
            }

            byte[] raw = source.readAllBytes();
            int bytesPerSample = bitDepth / 8;
            int aligned = PcmFormat.alignedLength(raw.length, bytesPerSample, channels);
            if (aligned == 0) {
                throw new MediaFormatException("Audio container has no audio frames");
            }
            byte[] pcm = Arrays.copyOf(raw, aligned);
            normalizeSamples(pcm, bytesPerSample, format.isBigEndian(),
                    AudioFormat.Encoding.PCM_UNSIGNED.equals(format.getEncoding()));
            return new DecodedAudio(pcm, Math.round(format.getSampleRate()), channels, bitDepth);
        } catch (UnsupportedAudioFileException | IOException e) {
            throw new MediaFormatException("Cannot decode audio container", e);
        }
    }

    /**
     * Converts signed little-endian PCM of any supported depth to 16-bit mono.
     * Stereo is averaged with equal weights.
     *
     * @throws MediaFormatException if {@code channels} is not 1 or 2, or the bit depth is unsupported
     */
    public static byte[] toMono16(byte[] pcm, int channels, int bitDepth) {
        if (channels != PcmFormat.MONO && channels != PcmFormat.STEREO) {
            throw new MediaFormatException("Unsupported channel count: " + channels);
        }
        if (bitDepth != 8 && bitDepth != 16 && bitDepth != 24 && bitDepth != 32) {
            throw new MediaFormatException("Unsupported bit depth: " + bitDepth);
        }
        int bytesPerSample = bitDepth / 8;
        int frameSize = bytesPerSample * channels;
        int frames = pcm.length / frameSize;
        byte[] out = new byte[frames * PcmFormat.BYTES_PER_SAMPLE];
        for (int f = 0; f < frames; f++) {
            int offset = f * frameSize;
            int sample = sample16(pcm, offset, bytesPerSample);
            if (channels == PcmFormat.STEREO) {
                int right = sample16(pcm, offset + bytesPerSample, bytesPerSample);
                sample = (sample + right) / 2;
            }
            writeSample(out, f * PcmFormat.BYTES_PER_SAMPLE, sample);
        }
        return out;
    }

    /**
     * Resamples 16-bit mono PCM.
     *
     * @throws IllegalArgumentException if a rate is not positive
     */
    public static byte[] resample(byte[] pcm16Mono, int srcRate, int dstRate) {
        if (srcRate <= 0 || dstRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + srcRate + " -> " + dstRate);
        }
        int inSamples = pcm16Mono.length / PcmFormat.BYTES_PER_SAMPLE;
        if (srcRate == dstRate || inSamples == 0) {
            return Arrays.copyOf(pcm16Mono, inSamples * PcmFormat.BYTES_PER_SAMPLE);
        }
        int outSamples = (int) ((long) inSamples * dstRate / srcRate);
        byte[] out = new byte[outSamples * PcmFormat.BYTES_PER_SAMPLE];
        double ratio = (double) srcRate / (double) dstRate;
        for (int i = 0; i < outSamples; i++) {
            double inPos = i * ratio;
            int inIdx = (int) inPos;
            double frac = inPos - inIdx;
            int a = sampleAt(pcm16Mono, inIdx, inSamples);
            int b = sampleAt(pcm16Mono, inIdx + 1, inSamples);
            writeSample(out, i * PcmFormat.BYTES_PER_SAMPLE, (int) Math.round(a + frac * (b - a)));
        }
        return out;
    }

    /**
     * Decodes a container and converts it to 16-bit mono at {@code targetRate}.
     *
     * @throws MediaFormatException if decoding fails or nothing is left after conversion
     */
    public static byte[] toPcm16Mono(byte[] container, int targetRate) {
        DecodedAudio decoded = decodeContainer(container);
        byte[] mono = toMono16(decoded.pcm(), decoded.channels(), decoded.bitDepth());
        byte[] resampled = resample(mono, decoded.sampleRate(), targetRate);
        if (resampled.length == 0) {
            throw new MediaFormatException("No audio left after conversion to " + targetRate + " Hz");
        }
        return resampled;
    }

    /**
     * Brings a 16-bit frame to mono at {@code targetRate}; frames already in that shape are returned as is.
     */
    public static AudioFrame normalize(AudioFrame frame, int targetRate) {
        if (frame.channels() == PcmFormat.MONO && frame.sampleRate() == targetRate) {
            return frame;
        }
        byte[] mono = toMono16(frame.pcm(), frame.channels(), 16);
        byte[] resampled = resample(mono, frame.sampleRate(), targetRate);
        return new AudioFrame(frame.sequenceId(), frame.direction(), resampled, targetRate, PcmFormat.MONO,
                resampled.length / PcmFormat.BYTES_PER_SAMPLE);
    }

    private static boolean isLinearPcm(AudioFormat.Encoding encoding) {
        return AudioFormat.Encoding.PCM_SIGNED.equals(encoding) || AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding);
    }

    /** Rewrites samples in place as signed little-endian. */
    private static void normalizeSamples(byte[] pcm, int bytesPerSample, boolean bigEndian, boolean unsigned) {
        for (int offset = 0; offset + bytesPerSample <= pcm.length; offset += bytesPerSample) {
            if (bigEndian && bytesPerSample > 1) {
                for (int lo = offset, hi = offset + bytesPerSample - 1; lo < hi; lo++, hi--) {
                    byte tmp = pcm[lo];
                    pcm[lo] = pcm[hi];
                    pcm[hi] = tmp;
                }
            }
            if (unsigned) {
                pcm[offset + bytesPerSample - 1] ^= (byte) 0x80;
            }
        }
    }

    /** Reads one signed little-endian sample and scales it to 16 bits. */
    private static int sample16(byte[] pcm, int offset, int bytesPerSample) {
        int msb = offset + bytesPerSample - 1;
        if (bytesPerSample == 1) {
            return pcm[offset] << 8;
        }
        return (pcm[msb - 1] & 0xFF) | (pcm[msb] << 8);
    }

    private static int sampleAt(byte[] pcm16, int index, int totalSamples) {
        int clamped = Math.min(index, totalSamples - 1);
        int offset = clamped * PcmFormat.BYTES_PER_SAMPLE;
        return (pcm16[offset] & 0xFF) | (pcm16[offset + 1] << 8);
    }

    static void writeSample(byte[] out, int offset, int sample) {
        int clamped = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, sample));
        out[offset] = (byte) clamped;
        out[offset + 1] = (byte) (clamped >> 8);
    }
}
