package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.context.ChatMessage;
import com.phillippitts.liveagent.service.pipeline.PipelineStatus;

import java.time.Duration;
import java.util.List;

/**
 * Structured end-of-call report handed to {@link CallOutcomeReporter}s.
 *
 * @param callId      external call id
 * @param sessionId   pipeline session id
 * @param status      terminal pipeline status
 * @param duration    wall-clock session length
 * @param transferred whether a tool transferred the call
 * @param result      business outcome reported by a tool, or {@code null}
 * @param finalTurns  last user and assistant turns, oldest first
 */
public record CallSummary(
        String callId,
        String sessionId,
        PipelineStatus status,
        Duration duration,
        boolean transferred,
        String result,
        List<ChatMessage> finalTurns
) {
}
