package com.phillippitts.liveagent.service.avatar;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.ImageFrame;
import com.phillippitts.liveagent.domain.MediaStream;

/**
 * An external animated-avatar renderer.
 *
 * <p>Depending on {@link #inputMode()} the renderer is driven by synthesized speech audio or by
 * sentence text it voices itself. Either way it returns lip-synced audio and video through its
 * media streams. One instance serves one session.
 *
 * <p>Failures are reported as {@link com.phillippitts.liveagent.exception.UpstreamServiceException}.
 */
public interface AvatarRenderingService {

    enum InputMode {
        /** Renderer lip-syncs to synthesized speech. */
        AUDIO,
        /** Renderer voices sentence chunks itself. */
        TEXT
    }

    String name();

    InputMode inputMode();

    /** Opens the rendering session. */
    void start(String sessionId);

    /** Cheap connection check run before every send. */
    boolean isConnected();

    void sendAudio(AudioFrame audio);

    void sendText(String text);

    /** Stops the utterance being rendered. */
    void interrupt();

    /** Lip-synced audio rendered by the avatar; available after {@link #start}. */
    MediaStream<AudioFrame> audioStream();

    /** Avatar video; available after {@link #start}. */
    MediaStream<ImageFrame> videoStream();

    /** Releases the rendering session and ends both media streams. */
    void stop();
}
