package com.phillippitts.liveagent.service.recognition;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.exception.UpstreamServiceException;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.service.pipeline.StageContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Feeds participant audio to the recognizer and emits transcripts.
 *
 * <p>Inbound audio is consumed here. A reader task pushes partial and final transcripts
 * downstream, and an INTERRUPTION whenever the participant starts speaking, so in-flight bot
 * speech stops.
 */
public class RecognitionStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(RecognitionStage.class);

    private final SpeechRecognitionService recognizer;
    private volatile RecognitionSession session;

    public RecognitionStage(SpeechRecognitionService recognizer) {
        super("recognition");
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof ControlFrame control && control.is(ControlType.START)) {
            openSession();
            return;
        }
        if (frame instanceof AudioFrame audio && audio.direction() == FrameDirection.DOWNSTREAM) {
            RecognitionSession current = session;
            if (current != null) {
                current.submit(audio);
            }
            return;
        }
        passThrough(frame, sink);
    }

    private void openSession() {
        StageContext ctx = context();
        try {
            session = recognizer.open(ctx.sessionId());
        } catch (UpstreamServiceException e) {
            throw new ConnectionException(recognizer.name(), 1, "Cannot open recognition stream", e);
        }
        RecognitionSession opened = session;
        String sessionId = ctx.sessionId();
        ctx.taskExecutor().execute(() -> readEvents(opened, ctx, sessionId));
        LOG.info("Recognition stream open on {}", recognizer.name());
    }

    private void readEvents(RecognitionSession source, StageContext ctx, String sessionId) {
        ThreadContext.put("sessionId", sessionId);
        try {
            Optional<RecognitionEvent> event;
            while (ctx.isActive() && (event = source.next()).isPresent()) {
                publish(event.get(), ctx);
            }
        } catch (RuntimeException e) {
            if (ctx.isActive()) {
                ctx.reportError(e);
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
        LOG.debug("Recognition reader exited");
    }

    private void publish(RecognitionEvent event, StageContext ctx) {
        FrameSink out = ctx.output();
        switch (event.type()) {
            case SPEECH_STARTED -> out.push(ControlFrame.of(ControlType.INTERRUPTION));
            case PARTIAL -> out.push(TextFrame.transcript(event.text(), false));
            case FINAL -> {
                ctx.markActivity();
                out.push(TextFrame.transcript(event.text(), true));
            }
        }
    }

    @Override
    public void close() {
        RecognitionSession current = session;
        session = null;
        if (current != null) {
            current.close();
        }
    }
}
