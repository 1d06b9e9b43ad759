package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.avatar.AvatarFallbackController;
import com.phillippitts.liveagent.service.avatar.AvatarState;
import com.phillippitts.liveagent.service.context.ConversationContextManager;
import com.phillippitts.liveagent.service.pipeline.PipelineTask;

import java.time.Instant;
import java.util.Optional;

/**
 * A running call: its pipeline handle plus the per-session state reported at the end.
 */
public final class CallSession {

    private final String sessionId;
    private final String callId;
    private final PipelineTask task;
    private final ConversationContextManager conversation;
    private final AvatarFallbackController avatar;
    private final CallOutcome outcome;
    private final Instant startedAt;

    CallSession(String sessionId, String callId, PipelineTask task, SessionPipeline pipeline, CallOutcome outcome) {
        this.sessionId = sessionId;
        this.callId = callId;
        this.task = task;
        this.conversation = pipeline.conversation();
        this.avatar = pipeline.avatar();
        this.outcome = outcome;
        this.startedAt = Instant.now();
    }

    public String sessionId() {
        return sessionId;
    }

    public String callId() {
        return callId;
    }

    public PipelineTask task() {
        return task;
    }

    public ConversationContextManager conversation() {
        return conversation;
    }

    public Optional<AvatarFallbackController> avatar() {
        return Optional.ofNullable(avatar);
    }

    /** Avatar state, or empty for a voice-only call. */
    public Optional<AvatarState> avatarState() {
        return avatar().map(AvatarFallbackController::state);
    }

    public CallOutcome outcome() {
        return outcome;
    }

    public Instant startedAt() {
        return startedAt;
    }
}
