package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.context.ChatMessage;

import java.util.List;

/**
 * Per-call parameters.
 *
 * @param callId        external call id for reporting; {@code null} uses the session id
 * @param systemPrompt  prompt for this call; {@code null} uses {@code pipeline.system-prompt}
 * @param priorMessages prior-call memory of a returning caller, possibly empty
 */
public record CallSessionRequest(String callId, String systemPrompt, List<ChatMessage> priorMessages) {

    public CallSessionRequest {
        priorMessages = priorMessages == null ? List.of() : List.copyOf(priorMessages);
    }

    public static CallSessionRequest defaults() {
        return new CallSessionRequest(null, null, List.of());
    }
}
