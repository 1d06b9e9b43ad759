package com.phillippitts.liveagent.service.llm;

import java.util.Optional;

/**
 * Streamed response to a {@link CompletionRequest}.
 *
 * <p>{@link #close()} may be called from another thread to abandon the response; a blocked
 * {@link #next()} must then return promptly.
 */
public interface CompletionStream extends AutoCloseable {

    /**
     * @return the next event, or empty when the response is complete
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException on a service failure
     */
    Optional<CompletionEvent> next();

    @Override
    void close();
}
