package com.phillippitts.liveagent.service.llm;

/**
 * Streaming chat-completion model.
 *
 * <p>Implementations wrap a concrete provider API. They must be safe for use by several sessions
 * at once; each {@link #complete} call returns an independent stream.
 */
public interface LanguageModelService {

    /** Service name for logs and errors. */
    String name();

    /**
     * Starts a completion.
     *
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the request is rejected
     */
    CompletionStream complete(CompletionRequest request);
}
