package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.exception.MediaFormatException;
import org.junit.jupiter.api.Test;

import static com.phillippitts.liveagent.service.audio.AudioTestSupport.constantPcm16;
import static com.phillippitts.liveagent.service.audio.AudioTestSupport.sampleAt;
import static com.phillippitts.liveagent.service.audio.AudioTestSupport.wav;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmFormatConverterTest {

    @Test
    void resamplingPreservesDuration() {
        byte[] oneHundredMs = constantPcm16(1600, 1, 1200);

        byte[] down = PcmFormatConverter.resample(oneHundredMs, 16_000, 8_000);
        byte[] up = PcmFormatConverter.resample(oneHundredMs, 16_000, 48_000);

        assertThat(down).hasSize(800 * 2);
        assertThat(up).hasSize(4800 * 2);
        assertThat(sampleAt(up, 100)).isEqualTo(1200);
    }

    @Test
    void resampleRejectsNonPositiveRates() {
        assertThatThrownBy(() -> PcmFormatConverter.resample(new byte[4], 0, 16_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stereoIsAveragedToMono() {
        byte[] stereo = new byte[4];
        stereo[0] = (byte) 1000;
        stereo[1] = (byte) (1000 >> 8);
        stereo[2] = (byte) 3000;
        stereo[3] = (byte) (3000 >> 8);

        byte[] mono = PcmFormatConverter.toMono16(stereo, 2, 16);

        assertThat(mono).hasSize(2);
        assertThat(sampleAt(mono, 0)).isEqualTo(2000);
    }

    @Test
    void eightAndTwentyFourBitSamplesAreScaledTo16Bit() {
        byte[] eightBit = {0x40};
        byte[] twentyFourBit = {0x00, 0x00, 0x40};

        assertThat(sampleAt(PcmFormatConverter.toMono16(eightBit, 1, 8), 0)).isEqualTo(16_384);
        assertThat(sampleAt(PcmFormatConverter.toMono16(twentyFourBit, 1, 24), 0)).isEqualTo(16_384);
    }

    @Test
    void trailingPartialSampleIsTruncated() {
        assertThat(PcmFormatConverter.toMono16(new byte[5], 1, 16)).hasSize(4);
    }

    @Test
    void rejectsUnsupportedChannelCount() {
        assertThatThrownBy(() -> PcmFormatConverter.toMono16(new byte[12], 3, 16))
                .isInstanceOf(MediaFormatException.class)
                .hasMessageContaining("channel");
    }

    @Test
    void decodesWavContainer() {
        byte[] container = wav(constantPcm16(441, 2, 500), 44_100, 2);

        DecodedAudio decoded = PcmFormatConverter.decodeContainer(container);

        assertThat(decoded.sampleRate()).isEqualTo(44_100);
        assertThat(decoded.channels()).isEqualTo(2);
        assertThat(decoded.bitDepth()).isEqualTo(16);
        assertThat(decoded.frameCount()).isEqualTo(441);
    }

    @Test
    void containerWithoutFramesIsRejected() {
        byte[] empty = wav(new byte[0], 16_000, 1);

        assertThatThrownBy(() -> PcmFormatConverter.decodeContainer(empty))
                .isInstanceOf(MediaFormatException.class);
    }

    @Test
    void garbageContainerIsRejected() {
        assertThatThrownBy(() -> PcmFormatConverter.decodeContainer(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}))
                .isInstanceOf(MediaFormatException.class);
    }

    @Test
    void convertsStereo48kContainerToMono16k() {
        byte[] container = wav(constantPcm16(4800, 2, 700), 48_000, 2);

        byte[] pcm = PcmFormatConverter.toPcm16Mono(container, 16_000);

        assertThat(pcm).hasSize(1600 * 2);
        assertThat(sampleAt(pcm, 800)).isEqualTo(700);
    }

    @Test
    void normalizeLeavesMatchingFrameAlone() {
        AudioFrame frame = AudioFrame.of(constantPcm16(160, 1, 1), 16_000, 1);

        assertThat(PcmFormatConverter.normalize(frame, 16_000)).isSameAs(frame);
    }

    @Test
    void normalizeDownmixesAndResamples() {
        AudioFrame frame = AudioFrame.of(constantPcm16(480, 2, 300), 24_000, 2);

        AudioFrame normalized = PcmFormatConverter.normalize(frame, 16_000);

        assertThat(normalized.channels()).isEqualTo(1);
        assertThat(normalized.sampleRate()).isEqualTo(16_000);
        assertThat(normalized.numSamples()).isEqualTo(320);
        assertThat(normalized.sequenceId()).isEqualTo(frame.sequenceId());
    }
}
