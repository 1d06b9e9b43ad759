package com.phillippitts.liveagent.service.context;

import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.service.vision.AttachmentOutcome;
import com.phillippitts.liveagent.service.vision.event.SnapshotAttachmentEvent;
import com.phillippitts.liveagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns final user transcripts into context turns and signals TURN_READY.
 * Partial transcripts are dropped here.
 */
public class UserTurnStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(UserTurnStage.class);
    private static final int LOG_PREVIEW_CHARS = 80;

    private final ConversationContextManager conversation;
    private final ApplicationEventPublisher publisher;

    public UserTurnStage(ConversationContextManager conversation, ApplicationEventPublisher publisher) {
        super("user-turn");
        this.conversation = Objects.requireNonNull(conversation, "conversation");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof TextFrame text && text.speaker() == TextFrame.Speaker.USER) {
            if (text.finalText() && !text.text().isBlank()) {
                completeTurn(text.text().strip(), sink);
            }
            return;
        }
        passThrough(frame, sink);
    }

    private void completeTurn(String text, FrameSink sink) {
        AttachmentOutcome outcome = conversation.addUserTurn(text);
        if (outcome != AttachmentOutcome.DISABLED) {
            publisher.publishEvent(new SnapshotAttachmentEvent(context().sessionId(), outcome, Instant.now()));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("User turn ready: \"{}\" (snapshot: {})", LogSanitizer.preview(text, LOG_PREVIEW_CHARS), outcome);
        }
        context().markActivity();
        sink.push(ControlFrame.of(ControlType.TURN_READY));
    }
}
