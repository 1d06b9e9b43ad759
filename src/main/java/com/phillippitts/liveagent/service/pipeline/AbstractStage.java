package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.Frame;

import java.util.Objects;

/**
 * Base class for stages that keep their {@link StageContext}.
 */
public abstract class AbstractStage implements Stage {

    private final String name;
    private volatile StageContext context;

    protected AbstractStage(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public void open(StageContext context) {
        this.context = context;
    }

    /**
     * @throws IllegalStateException if called before {@link #open}
     */
    protected StageContext context() {
        StageContext current = context;
        if (current == null) {
            throw new IllegalStateException("Stage " + name + " is not open");
        }
        return current;
    }

    protected boolean isOpen() {
        return context != null;
    }

    /**
     * Pushes a frame the stage does not consume. Lifecycle frames are skipped because the
     * executor forwards them.
     */
    protected static void passThrough(Frame frame, FrameSink sink) {
        if (!isLifecycle(frame)) {
            sink.push(frame);
        }
    }

    protected static boolean isLifecycle(Frame frame) {
        return frame instanceof ControlFrame control && control.type().isLifecycle();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '[' + name + ']';
    }
}
