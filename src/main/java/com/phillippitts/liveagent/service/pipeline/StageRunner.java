package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.util.PipelineTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one stage: a FIFO inbox drained by a dedicated task.
 *
 * <p>Downstream data frames take a permit from a semaphore sized to the inbox capacity, so a
 * producer blocks while this stage is behind. Control frames and upstream frames never wait for
 * a permit, which keeps interruption, cancellation and error tags flowing while data is backed up.
 *
 * <p>Interruption bumps the runner epoch. Data frames queued before the bump carry the old epoch
 * and are discarded when dequeued.
 */
final class StageRunner implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StageRunner.class);

    private final Stage stage;
    private final int index;
    private final PipelineTask task;
    private final LinkedBlockingDeque<Envelope> inbox = new LinkedBlockingDeque<>();
    private final Semaphore permits;
    private final AtomicLong epoch = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final FrameSink sink;
    private final StageContext context = new RunnerContext();

    // Runner thread only
    private long discarded;

    StageRunner(Stage stage, int index, int inboxCapacity, PipelineTask task) {
        this.stage = stage;
        this.index = index;
        this.task = task;
        this.permits = new Semaphore(inboxCapacity);
        this.sink = frame -> task.emit(index, frame);
    }

    String name() {
        return stage.name();
    }

    int index() {
        return index;
    }

    /**
     * Queues a frame for this stage, blocking for a permit if it is a downstream data frame.
     *
     * @return {@code false} if the frame was discarded because the runner or session is closing
     */
    boolean offer(Frame frame) {
        if (closed.get()) {
            return false;
        }
        if (frame.isData() && frame.direction() == FrameDirection.DOWNSTREAM) {
            // Epoch is read before waiting so a frame produced ahead of an interruption stays stale
            long producedAt = epoch.get();
            if (!acquirePermit()) {
                return false;
            }
            inbox.offer(new Envelope(frame, producedAt, true));
            return true;
        }
        inbox.offer(new Envelope(frame, epoch.get(), false));
        return true;
    }

    /** Stops in-flight work and jumps the queue with a CANCEL frame. No-op once the runner has exited. */
    void cancel() {
        if (closed.get()) {
            return;
        }
        interrupt();
        inbox.offerFirst(new Envelope(ControlFrame.of(ControlType.CANCEL), epoch.get(), false));
    }

    /** Invalidates queued data frames and notifies the stage. Called on the interrupting thread. */
    void interrupt() {
        epoch.incrementAndGet();
        try {
            stage.onInterruption();
        } catch (RuntimeException e) {
            LOG.warn("Stage {} failed to handle interruption: {}", stage.name(), e.toString());
        }
    }

    /** Marks a runner that was never scheduled as finished. */
    void abandon() {
        closed.set(true);
    }

    @Override
    public void run() {
        ThreadContext.put("sessionId", task.sessionId());
        ThreadContext.put("stage", stage.name());
        try {
            stage.open(context);
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Stage {} interrupted", stage.name());
        } catch (RuntimeException e) {
            task.stageFailed(index, null, e, true);
        } finally {
            closed.set(true);
            inbox.clear();
            closeStage();
            if (discarded > 0) {
                LOG.debug("Stage {} discarded {} interrupted frames", stage.name(), discarded);
            }
            ThreadContext.remove("stage");
            task.runnerExited(this);
        }
    }

    private void loop() throws InterruptedException {
        while (true) {
            Envelope envelope = inbox.take();
            if (envelope.permitted()) {
                permits.release();
            }
            Frame frame = envelope.frame();
            if (isStale(envelope)) {
                discarded++;
                continue;
            }

            ControlType type = frame instanceof ControlFrame control ? control.type() : null;
            boolean settled = dispatch(frame);
            if (type == ControlType.CANCEL) {
                return;
            }
            if (type != null && type.isLifecycle()) {
                task.forward(index, frame);
            } else if (!settled) {
                // Recoverable failure before the stage emitted the frame: it continues unaffected
                task.forward(index, frame);
            }
            if (type == ControlType.END && frame.direction() == FrameDirection.DOWNSTREAM) {
                return;
            }
        }
    }

    private boolean isStale(Envelope envelope) {
        Frame frame = envelope.frame();
        return frame.isData()
                && frame.direction() == FrameDirection.DOWNSTREAM
                && envelope.epoch() < epoch.get();
    }

    /**
     * @return {@code true} if the stage completed, or failed after it had already pushed the frame
     *         (or a replacement with the same sequence id) on
     */
    private boolean dispatch(Frame frame) {
        TrackingSink tracking = new TrackingSink(frame.sequenceId());
        try {
            stage.process(frame, tracking);
            return true;
        } catch (Exception e) {
            task.stageFailed(index, frame, e, false);
            return tracking.emitted;
        }
    }

    private boolean acquirePermit() {
        long pollNanos = PipelineTimeouts.INBOX_OFFER_POLL.toNanos();
        try {
            while (!permits.tryAcquire(pollNanos, TimeUnit.NANOSECONDS)) {
                if (closed.get() || task.isTerminating()) {
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void closeStage() {
        try {
            stage.close();
        } catch (RuntimeException e) {
            LOG.warn("Stage {} failed to close: {}", stage.name(), e.toString());
        }
    }

    private record Envelope(Frame frame, long epoch, boolean permitted) { }

    /** Sink handed to one {@code process} call; notes whether the frame in hand was pushed on. */
    private final class TrackingSink implements FrameSink {

        private final long sequenceId;
        private volatile boolean emitted;

        TrackingSink(long sequenceId) {
            this.sequenceId = sequenceId;
        }

        @Override
        public void push(Frame frame) {
            sink.push(frame);
            if (frame.sequenceId() == sequenceId) {
                emitted = true;
            }
        }
    }

    private final class RunnerContext implements StageContext {

        @Override
        public String sessionId() {
            return task.sessionId();
        }

        @Override
        public FrameSink output() {
            return sink;
        }

        @Override
        public Executor taskExecutor() {
            return task.executor();
        }

        @Override
        public void reportError(Throwable error) {
            task.stageFailed(index, null, error, false);
        }

        @Override
        public void markActivity() {
            task.markActivity();
        }

        @Override
        public boolean isActive() {
            return !closed.get() && !task.isTerminating();
        }
    }
}
