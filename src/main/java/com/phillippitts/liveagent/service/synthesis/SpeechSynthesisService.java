package com.phillippitts.liveagent.service.synthesis;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.MediaStream;
import com.phillippitts.liveagent.service.connection.StreamingConnection;

/**
 * Streaming text-to-speech over a persistent connection.
 *
 * <p>The connection is opened through a {@link com.phillippitts.liveagent.service.connection.ResilientConnection};
 * {@link #isOpen()} is the check it uses. One instance serves one session.
 */
public interface SpeechSynthesisService extends StreamingConnection {

    /**
     * Looks up the service's default voice. May be slow; callers cache the result per service.
     *
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the lookup fails
     */
    String defaultVoice();

    /**
     * Synthesizes one chunk of text.
     *
     * @return audio for the chunk; closing it stops synthesis of the chunk
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the request fails
     */
    MediaStream<AudioFrame> speak(String text, String voice);
}
