package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.avatar.AvatarFallbackController;
import com.phillippitts.liveagent.service.context.ConversationContextManager;
import com.phillippitts.liveagent.service.pipeline.Stage;

import java.time.Duration;
import java.util.List;

/**
 * Stages and per-session components assembled by {@link CallSessionFactory}.
 *
 * @param avatar {@code null} for voice-only calls
 */
public record SessionPipeline(
        List<Stage> stages,
        ConversationContextManager conversation,
        AvatarFallbackController avatar,
        Duration idleTimeout
) {

    public List<String> stageNames() {
        return stages.stream().map(Stage::name).toList();
    }
}
