package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.context.ChatMessage;

/**
 * Receives conversational turns as they happen. Beans implementing this interface are attached
 * to every session.
 */
public interface TranscriptSink {

    /**
     * @param role {@code USER} or {@code ASSISTANT}
     * @param text turn text with images rendered as {@code [image]}
     */
    void record(String sessionId, ChatMessage.Role role, String text);
}
