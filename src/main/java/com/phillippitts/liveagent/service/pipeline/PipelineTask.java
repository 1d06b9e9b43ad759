package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.exception.ConfigurationException;
import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.exception.LiveAgentException;
import com.phillippitts.liveagent.service.pipeline.event.PipelineFinishedEvent;
import com.phillippitts.liveagent.service.pipeline.event.StageFailureEvent;
import com.phillippitts.liveagent.util.PipelineTimeouts;
import com.phillippitts.liveagent.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to one running pipeline session.
 *
 * <p>Routes frames between stage runners, applies the failure policy and tracks the terminal
 * status. A failure in the first stage (capture), the last stage (output), or any
 * {@link ConfigurationException} is fatal; so is a {@link ConnectionException} raised while a
 * stage handles START, because the session would otherwise run half-configured. Every other stage
 * failure becomes an upstream ERROR control frame and the failed frame continues unaffected.
 */
public final class PipelineTask {

    private static final Logger LOG = LogManager.getLogger(PipelineTask.class);
    private static final Duration MIN_IDLE_POLL = Duration.ofMillis(10);

    private final String sessionId;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final List<StageRunner> runners;
    private final AtomicReference<PipelineStatus> status = new AtomicReference<>(PipelineStatus.RUNNING);
    private final AtomicInteger running;
    private final CountDownLatch finished;
    private final long startedNanos = System.nanoTime();
    private volatile long lastActivityNanos = startedNanos;

    PipelineTask(String sessionId, List<? extends Stage> stages, int inboxCapacity,
                 Executor executor, ApplicationEventPublisher publisher) {
        this.sessionId = sessionId;
        this.executor = executor;
        this.publisher = publisher;
        List<StageRunner> built = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            built.add(new StageRunner(stages.get(i), i, inboxCapacity, this));
        }
        this.runners = List.copyOf(built);
        this.running = new AtomicInteger(runners.size());
        this.finished = new CountDownLatch(runners.size());
    }

    /**
     * Queues START and schedules one task per stage plus the idle watcher.
     *
     * @throws LiveAgentException if the executor rejects a stage task
     */
    void launch(Duration idleTimeout) {
        runners.get(0).offer(ControlFrame.of(ControlType.START));
        for (int i = 0; i < runners.size(); i++) {
            StageRunner runner = runners.get(i);
            try {
                executor.execute(runner);
            } catch (RejectedExecutionException e) {
                terminate(PipelineStatus.FAILED);
                for (int j = i; j < runners.size(); j++) {
                    runners.get(j).abandon();
                    runnerExited(runners.get(j));
                }
                throw new LiveAgentException("Pipeline executor rejected stage " + runner.name(), e);
            }
        }
        if (idleTimeout != null && !idleTimeout.isZero() && !idleTimeout.isNegative()) {
            executor.execute(() -> watchIdle(idleTimeout));
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public PipelineStatus status() {
        return status.get();
    }

    public boolean isTerminating() {
        return status.get() != PipelineStatus.RUNNING;
    }

    /**
     * Injects a frame at the head of the pipeline, as if the capture stage had produced it.
     * END here drains in-band; INTERRUPTION reaches every stage.
     */
    public void queueFrame(Frame frame) {
        emit(-1, frame);
    }

    /**
     * Cancels the session out-of-band. Queued data is discarded and every stage sees CANCEL next.
     */
    public void cancel() {
        terminate(PipelineStatus.CANCELLED);
    }

    /**
     * Blocks until every stage task has exited.
     *
     * @return the terminal status
     */
    public PipelineStatus await() throws InterruptedException {
        finished.await();
        return status.get();
    }

    /**
     * @return {@code true} if the session finished within the timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    Executor executor() {
        return executor;
    }

    void markActivity() {
        lastActivityNanos = System.nanoTime();
    }

    /** Frame produced by a stage (or injected at index -1). Interruptions are broadcast first. */
    void emit(int fromIndex, Frame frame) {
        if (frame instanceof ControlFrame control
                && control.is(ControlType.INTERRUPTION)
                && frame.direction() == FrameDirection.DOWNSTREAM) {
            broadcastInterruption(fromIndex);
        }
        route(fromIndex, frame);
    }

    /** Frame passed on by the executor itself after the stage saw it. */
    void forward(int fromIndex, Frame frame) {
        route(fromIndex, frame);
    }

    private void route(int fromIndex, Frame frame) {
        if (isTerminating()) {
            return;
        }
        if (frame.direction() == FrameDirection.DOWNSTREAM) {
            int target = fromIndex + 1;
            if (target >= runners.size()) {
                leftPipeline(frame);
                return;
            }
            runners.get(target).offer(frame);
        } else {
            int target = fromIndex - 1;
            if (target < 0) {
                reachedHead(frame);
                return;
            }
            runners.get(target).offer(frame);
        }
    }

    private void broadcastInterruption(int fromIndex) {
        LOG.debug("Interruption from stage index {} in session {}", fromIndex, sessionId);
        for (int i = fromIndex + 1; i < runners.size(); i++) {
            runners.get(i).interrupt();
        }
    }

    private void leftPipeline(Frame frame) {
        if (frame instanceof ControlFrame control && control.is(ControlType.END)) {
            terminate(PipelineStatus.COMPLETED);
        }
    }

    private void reachedHead(Frame frame) {
        if (frame instanceof ControlFrame control && control.is(ControlType.ERROR)) {
            LOG.debug("Error tag reached pipeline head: {}", control.errorTag());
        }
    }

    void stageFailed(int index, Frame frame, Throwable error, boolean forceFatal) {
        StageRunner runner = runners.get(index);
        boolean fatal = forceFatal || isFatal(index, frame, error);
        String tag = runner.name() + ':' + error.getClass().getSimpleName();
        if (fatal) {
            LOG.error("Fatal failure in stage {} (session {})", runner.name(), sessionId, error);
        } else {
            LOG.warn("Stage {} failed on {}: {}", runner.name(), frame == null ? "background task" : frame,
                    error.toString());
        }
        publisher.publishEvent(new StageFailureEvent(sessionId, runner.name(), tag, fatal, Instant.now()));
        if (fatal) {
            terminate(PipelineStatus.FAILED);
        } else {
            route(index, ControlFrame.error(tag, false));
        }
    }

    private boolean isFatal(int index, Frame frame, Throwable error) {
        if (index == 0 || index == runners.size() - 1) {
            return true;
        }
        if (error instanceof ConfigurationException) {
            return true;
        }
        return error instanceof ConnectionException
                && frame instanceof ControlFrame control
                && control.is(ControlType.START);
    }

    /**
     * Moves the session to a terminal status. Only the first call has an effect.
     */
    boolean terminate(PipelineStatus terminal) {
        if (!status.compareAndSet(PipelineStatus.RUNNING, terminal)) {
            return false;
        }
        LOG.info("Session {} ending: status={}", sessionId, terminal);
        // After a clean END only stages upstream of the END producer are still running
        for (StageRunner runner : runners) {
            runner.cancel();
        }
        return true;
    }

    void runnerExited(StageRunner runner) {
        LOG.debug("Stage {} exited (session {})", runner.name(), sessionId);
        if (running.decrementAndGet() == 0) {
            status.compareAndSet(PipelineStatus.RUNNING, PipelineStatus.CANCELLED);
            long durationMs = TimeUtils.elapsedMillis(startedNanos);
            LOG.info("Session {} finished: status={}, durationMs={}", sessionId, status.get(), durationMs);
            publisher.publishEvent(new PipelineFinishedEvent(sessionId, status.get(), durationMs, Instant.now()));
        }
        finished.countDown();
    }

    private void watchIdle(Duration idleTimeout) {
        long pollNanos = Math.max(MIN_IDLE_POLL.toNanos(),
                Math.min(PipelineTimeouts.IDLE_CHECK_INTERVAL.toNanos(), idleTimeout.toNanos() / 4));
        try {
            while (!finished.await(pollNanos, TimeUnit.NANOSECONDS)) {
                if (!isTerminating() && TimeUtils.hasElapsed(lastActivityNanos, System.nanoTime(), idleTimeout)) {
                    LOG.info("Session {} idle for {}; cancelling", sessionId, idleTimeout);
                    terminate(PipelineStatus.IDLE_TIMEOUT);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
