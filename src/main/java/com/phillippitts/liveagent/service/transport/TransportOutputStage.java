package com.phillippitts.liveagent.service.transport;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.domain.ImageFrame;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Output stage: sends bot audio, avatar video and assistant text to the room.
 * Last in the pipeline, so a send failure ends the session.
 */
public class TransportOutputStage extends AbstractStage {

    private final RealTimeTransport transport;
    private final AtomicLong audioFramesSent = new AtomicLong();

    public TransportOutputStage(RealTimeTransport transport) {
        super("transport-output");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame.direction() != FrameDirection.DOWNSTREAM) {
            passThrough(frame, sink);
            return;
        }
        if (frame instanceof AudioFrame) {
            transport.send(frame);
            audioFramesSent.incrementAndGet();
            context().markActivity();
        } else if (frame instanceof ImageFrame) {
            transport.send(frame);
        } else if (frame instanceof TextFrame text && text.speaker() == TextFrame.Speaker.ASSISTANT) {
            transport.send(frame);
        }
    }

    public long audioFramesSent() {
        return audioFramesSent.get();
    }
}
