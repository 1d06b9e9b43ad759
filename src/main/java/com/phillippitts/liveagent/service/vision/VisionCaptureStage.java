package com.phillippitts.liveagent.service.vision;

import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.domain.ImageFrame;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Stores participant camera frames as snapshots, at most one per {@code 1/fps} window.
 *
 * <p>Camera frames are consumed here and never travel further downstream. Frames that arrive
 * inside the current window are dropped.
 */
public class VisionCaptureStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(VisionCaptureStage.class);

    private final VisionSnapshotStore store;
    private final Duration interval;
    private final LongSupplier nanoClock;
    private boolean captured;
    private long lastCaptureNanos;
    private long droppedFrames;

    public VisionCaptureStage(VisionSnapshotStore store, int fps) {
        this(store, fps, System::nanoTime);
    }

    public VisionCaptureStage(VisionSnapshotStore store, int fps, LongSupplier nanoClock) {
        super("vision-capture");
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive, got: " + fps);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.interval = Duration.ofNanos(1_000_000_000L / fps);
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof ImageFrame image && image.direction() == FrameDirection.DOWNSTREAM) {
            capture(image);
            return;
        }
        passThrough(frame, sink);
    }

    private void capture(ImageFrame image) {
        long now = nanoClock.getAsLong();
        if (captured && !TimeUtils.hasElapsed(lastCaptureNanos, now, interval)) {
            droppedFrames++;
            return;
        }
        store.update(VisionSnapshot.of(image, now));
        captured = true;
        lastCaptureNanos = now;
        LOG.trace("Captured snapshot {}", image);
    }

    public long droppedFrames() {
        return droppedFrames;
    }
}
