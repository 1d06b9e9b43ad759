package com.phillippitts.liveagent.service.recognition;

import com.phillippitts.liveagent.domain.AudioFrame;

import java.util.Optional;

/**
 * One open recognition stream. Audio is submitted from the stage task while a separate reader
 * task pulls events.
 */
public interface RecognitionSession extends AutoCloseable {

    /**
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the stream rejected the audio
     */
    void submit(AudioFrame audio);

    /**
     * Blocks for the next event.
     *
     * @return the event, or empty once the session is closed
     */
    Optional<RecognitionEvent> next();

    /** Ends the stream; unblocks a pending {@link #next()}. */
    @Override
    void close();
}
