package com.phillippitts.liveagent.service.avatar;

import com.phillippitts.liveagent.config.properties.AvatarProperties;
import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.FrameDirection;
import com.phillippitts.liveagent.domain.ImageFrame;
import com.phillippitts.liveagent.domain.MediaStream;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.service.audio.PcmFormatConverter;
import com.phillippitts.liveagent.service.avatar.event.AvatarDegradedEvent;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.service.pipeline.StageContext;
import com.phillippitts.liveagent.service.text.TextFlushBuffer;
import com.phillippitts.liveagent.util.PipelineTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Renders bot speech through an avatar and falls back to audio-only when the avatar fails.
 *
 * <p>While {@link AvatarState#ACTIVE}, speech audio (or, for text-driven renderers, sentence
 * chunks) is queued for a sender task, and receiver tasks forward the avatar's audio and video to
 * the output once the transport is ready. Received audio is normalized to mono at the output rate.
 *
 * <p>The first of these failures degrades the session:
 * <ul>
 *   <li>the avatar cannot be started</li>
 *   <li>the connection check fails when a frame is about to be sent</li>
 *   <li>the sender task fails or ends</li>
 *   <li>a media stream ends or fails while the avatar should be rendering</li>
 * </ul>
 * Degrading is idempotent and one-way. The frame in flight is passed straight through, the avatar
 * is stopped on a background task, and from then on audio bypasses the avatar and text is no
 * longer sent to it.
 */
public class AvatarFallbackController extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(AvatarFallbackController.class);

    private final AvatarRenderingService avatar;
    private final ApplicationEventPublisher publisher;
    private final int outputSampleRate;
    private final BlockingQueue<Outbound> sendQueue;
    private final TextFlushBuffer textBuffer;
    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile AvatarState state = AvatarState.ACTIVE;
    private volatile boolean transportReady;
    private volatile String degradeReason;

    public AvatarFallbackController(AvatarRenderingService avatar, AvatarProperties properties,
                                    int outputSampleRate, ApplicationEventPublisher publisher) {
        super("avatar");
        this.avatar = Objects.requireNonNull(avatar, "avatar");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.outputSampleRate = outputSampleRate;
        this.sendQueue = new LinkedBlockingQueue<>(properties.getSenderQueueCapacity());
        this.textBuffer = new TextFlushBuffer(properties.getTextFlushMaxChars());
    }

    public AvatarState state() {
        return state;
    }

    /** Reason of the degrade, or {@code null} while the avatar has not degraded. */
    public String degradeReason() {
        return degradeReason;
    }

    public String serviceName() {
        return avatar.name();
    }

    /**
     * {@code true} while a text-driven avatar voices the bot, so synthesized audio must be muted.
     */
    public boolean rendersSpeech() {
        return state == AvatarState.ACTIVE && avatar.inputMode() == AvatarRenderingService.InputMode.TEXT;
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof ControlFrame control) {
            handleControl(control, sink);
            return;
        }
        if (state != AvatarState.ACTIVE || frame.direction() != FrameDirection.DOWNSTREAM) {
            passThrough(frame, sink);
            return;
        }
        boolean textMode = avatar.inputMode() == AvatarRenderingService.InputMode.TEXT;
        if (frame instanceof AudioFrame audio && !textMode) {
            if (!enqueue(Outbound.audio(audio))) {
                sink.push(frame);
            }
            return;
        }
        if (frame instanceof TextFrame text && text.speaker() == TextFrame.Speaker.ASSISTANT && textMode) {
            sink.push(frame);
            textBuffer.append(text.text()).ifPresent(chunk -> enqueue(Outbound.text(chunk)));
            return;
        }
        passThrough(frame, sink);
    }

    private void handleControl(ControlFrame control, FrameSink sink) {
        switch (control.type()) {
            case START -> start();
            case TRANSPORT_READY -> {
                transportReady = true;
                sink.push(control);
            }
            case INTERRUPTION -> textBuffer.clear();
            case RESPONSE_END -> {
                if (state == AvatarState.ACTIVE && avatar.inputMode() == AvatarRenderingService.InputMode.TEXT) {
                    textBuffer.flush().ifPresent(chunk -> enqueue(Outbound.text(chunk)));
                }
                sink.push(control);
            }
            default -> passThrough(control, sink);
        }
    }

    private void start() {
        StageContext ctx = context();
        try {
            avatar.start(ctx.sessionId());
            MediaStream<AudioFrame> audio = avatar.audioStream();
            MediaStream<ImageFrame> video = avatar.videoStream();
            ctx.taskExecutor().execute(() -> runSender(ctx.sessionId()));
            ctx.taskExecutor().execute(() -> runReceiver("audio", audio,
                    frame -> PcmFormatConverter.normalize(frame, outputSampleRate), ctx));
            ctx.taskExecutor().execute(() -> runReceiver("video", video, UnaryOperator.identity(), ctx));
            LOG.info("Avatar {} started in {} mode", avatar.name(), avatar.inputMode());
        } catch (RuntimeException e) {
            degrade("start failed: " + e.getMessage());
        }
    }

    /**
     * Queues an item for the sender after checking the connection.
     *
     * @return {@code false} if the avatar is no longer active; the caller passes the frame through
     */
    private boolean enqueue(Outbound item) {
        if (!avatar.isConnected()) {
            degrade("connection check failed before send");
            return false;
        }
        long pollNanos = PipelineTimeouts.INBOX_OFFER_POLL.toNanos();
        try {
            while (state == AvatarState.ACTIVE) {
                if (sendQueue.offer(item, pollNanos, TimeUnit.NANOSECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void runSender(String sessionId) {
        ThreadContext.put("sessionId", sessionId);
        long pollNanos = PipelineTimeouts.INBOX_OFFER_POLL.toNanos();
        try {
            while (state == AvatarState.ACTIVE) {
                Outbound item = sendQueue.poll(pollNanos, TimeUnit.NANOSECONDS);
                if (item == null) {
                    continue;
                }
                if (item.audio() != null) {
                    avatar.sendAudio(item.audio());
                } else {
                    avatar.sendText(item.text());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            degrade("send failed: " + e.getMessage());
        } finally {
            if (state == AvatarState.ACTIVE) {
                degrade("sender task ended unexpectedly");
            }
            ThreadContext.remove("sessionId");
        }
    }

    private <T extends Frame> void runReceiver(String kind, MediaStream<T> stream, UnaryOperator<T> adapt,
                                               StageContext ctx) {
        ThreadContext.put("sessionId", ctx.sessionId());
        try {
            Optional<T> next;
            while (state == AvatarState.ACTIVE && (next = stream.next()).isPresent()) {
                if (transportReady && state == AvatarState.ACTIVE && ctx.isActive()) {
                    ctx.output().push(adapt.apply(next.get()));
                }
            }
            if (state == AvatarState.ACTIVE && ctx.isActive()) {
                degrade(kind + " stream ended");
            }
        } catch (RuntimeException e) {
            if (state == AvatarState.ACTIVE && ctx.isActive()) {
                degrade(kind + " stream failed: " + e.getMessage());
            }
        } finally {
            ThreadContext.remove("sessionId");
        }
    }

    @Override
    public void onInterruption() {
        if (state != AvatarState.ACTIVE) {
            return;
        }
        sendQueue.clear();
        try {
            avatar.interrupt();
        } catch (RuntimeException e) {
            LOG.debug("Avatar interrupt failed: {}", e.getMessage());
        }
    }

    /**
     * Falls back to audio-only. Only the first call while ACTIVE has an effect.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean degrade(String reason) {
        stateLock.lock();
        try {
            if (state != AvatarState.ACTIVE) {
                return false;
            }
            state = AvatarState.DEGRADED;
            degradeReason = reason;
        } finally {
            stateLock.unlock();
        }
        String sessionId = isOpen() ? context().sessionId() : "unknown";
        LOG.warn("Avatar {} degraded to audio-only (session {}): {}", avatar.name(), sessionId, reason);
        sendQueue.clear();
        publisher.publishEvent(new AvatarDegradedEvent(sessionId, avatar.name(), reason, Instant.now()));
        if (isOpen()) {
            context().taskExecutor().execute(this::stopAvatar);
        } else {
            stopAvatar();
        }
        return true;
    }

    @Override
    public void close() {
        AvatarState previous;
        stateLock.lock();
        try {
            previous = state;
            state = AvatarState.TERMINAL;
        } finally {
            stateLock.unlock();
        }
        sendQueue.clear();
        if (previous == AvatarState.ACTIVE) {
            stopAvatar();
        }
    }

    private void stopAvatar() {
        try {
            avatar.stop();
        } catch (RuntimeException e) {
            LOG.debug("Avatar {} stop failed during teardown: {}", avatar.name(), e.getMessage());
        }
    }

    private record Outbound(AudioFrame audio, String text) {

        static Outbound audio(AudioFrame audio) {
            return new Outbound(audio, null);
        }

        static Outbound text(String text) {
            return new Outbound(null, text);
        }
    }
}
