package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.exception.MediaFormatException;
import com.phillippitts.liveagent.service.audio.event.BackgroundMixDisabledEvent;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Mixes background ambience into downstream speech frames.
 *
 * <p>A frame that cannot be mixed always goes out unmixed. A format mismatch turns mixing off
 * for the rest of the session; any other failure affects only the frame that raised it.
 */
public class BackgroundMixerStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(BackgroundMixerStage.class);

    private final BackgroundTrack track;
    private final double gain;
    private final ApplicationEventPublisher publisher;
    private volatile boolean enabled;
    private long bypassedFrames;

    public BackgroundMixerStage(BackgroundTrack track, double gain, ApplicationEventPublisher publisher) {
        super("background-mixer");
        this.track = Objects.requireNonNull(track, "track");
        this.gain = gain;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.enabled = gain > 0.0;
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (enabled && frame instanceof AudioFrame audio && audio.direction() == FrameDirection.DOWNSTREAM) {
            sink.push(mixOrPass(audio));
            return;
        }
        passThrough(frame, sink);
    }

    private AudioFrame mixOrPass(AudioFrame audio) {
        try {
            return AudioMixer.mix(audio, track, gain);
        } catch (MediaFormatException e) {
            enabled = false;
            String sessionId = context().sessionId();
            LOG.warn("Background mixing disabled for session {}: {}", sessionId, e.getMessage());
            publisher.publishEvent(new BackgroundMixDisabledEvent(sessionId, e.getMessage(), Instant.now()));
            return audio;
        } catch (RuntimeException e) {
            bypassedFrames++;
            LOG.warn("Mixing failed for {}; sending it unmixed", audio, e);
            return audio;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Frames sent unmixed because of a per-frame failure. */
    public long bypassedFrames() {
        return bypassedFrames;
    }
}
