package com.phillippitts.liveagent.service.transport;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.service.pipeline.StageContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Capture stage: joins the room on START and feeds inbound frames into the pipeline.
 *
 * <p>A reader task pushes what the transport delivers and ends the session with END when the
 * participant leaves. This is the first stage, so any failure here ends the session.
 */
public class TransportInputStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(TransportInputStage.class);

    private final RealTimeTransport transport;

    public TransportInputStage(RealTimeTransport transport) {
        super("transport-input");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof ControlFrame control && control.is(ControlType.START)) {
            StageContext ctx = context();
            transport.join(ctx.sessionId());
            LOG.info("Joined {} for session {}", transport.name(), ctx.sessionId());
            sink.push(ControlFrame.of(ControlType.TRANSPORT_READY));
            ctx.taskExecutor().execute(() -> readInbound(ctx));
            return;
        }
        passThrough(frame, sink);
    }

    private void readInbound(StageContext ctx) {
        ThreadContext.put("sessionId", ctx.sessionId());
        FrameSink out = ctx.output();
        try {
            while (ctx.isActive()) {
                Optional<Frame> inbound = transport.receive();
                if (inbound.isEmpty()) {
                    LOG.info("Participant left session {}", ctx.sessionId());
                    out.push(ControlFrame.of(ControlType.END));
                    return;
                }
                Frame frame = inbound.get();
                if (frame instanceof AudioFrame) {
                    ctx.markActivity();
                }
                out.push(frame);
            }
        } catch (RuntimeException e) {
            if (ctx.isActive()) {
                ctx.reportError(e);
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    public void close() {
        transport.leave();
    }
}
