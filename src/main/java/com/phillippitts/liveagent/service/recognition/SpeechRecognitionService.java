package com.phillippitts.liveagent.service.recognition;

/**
 * Streaming speech-to-text.
 *
 * <p>Audio must be 16-bit mono PCM at the rate the implementation documents.
 */
public interface SpeechRecognitionService {

    String name();

    /**
     * Opens a recognition stream for one session.
     *
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the stream cannot be opened
     */
    RecognitionSession open(String sessionId);
}
