package com.phillippitts.liveagent.service.synthesis;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.MediaStream;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.exception.UpstreamServiceException;
import com.phillippitts.liveagent.service.connection.ResilientConnection;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.service.text.TextFlushBuffer;
import com.phillippitts.liveagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Speaks assistant text as it streams in.
 *
 * <p>Tokens are buffered to sentence boundaries and each chunk is synthesized as soon as it is
 * complete; RESPONSE_END flushes the rest. Assistant text frames are forwarded so later stages can
 * caption or render them. The connection is opened on START and re-checked before every chunk.
 *
 * <p>Interruption stops the chunk being streamed and drops buffered text. While {@code muted}
 * reports {@code true} (a text-driven avatar is speaking for the bot) no audio is produced.
 */
public class SynthesisStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(SynthesisStage.class);
    private static final int LOG_PREVIEW_CHARS = 60;

    private final SpeechSynthesisService synthesizer;
    private final ResilientConnection connection;
    private final Supplier<String> voiceResolver;
    private final BooleanSupplier muted;
    private final TextFlushBuffer buffer;
    private final AtomicLong generation = new AtomicLong();
    private volatile MediaStream<AudioFrame> speaking;
    private String voice;

    /**
     * @param voiceResolver supplies the voice on START
     * @param muted         {@code true} while audio must not be synthesized
     */
    public SynthesisStage(SpeechSynthesisService synthesizer, ResilientConnection connection,
                          Supplier<String> voiceResolver, BooleanSupplier muted, TextFlushBuffer buffer) {
        super("synthesis");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.voiceResolver = Objects.requireNonNull(voiceResolver, "voiceResolver");
        this.muted = Objects.requireNonNull(muted, "muted");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof TextFrame text && text.speaker() == TextFrame.Speaker.ASSISTANT) {
            Optional<String> chunk = buffer.append(text.text());
            sink.push(frame);
            chunk.ifPresent(c -> speak(c, sink));
            return;
        }
        if (frame instanceof ControlFrame control) {
            switch (control.type()) {
                case START -> {
                    connection.ensureConnected();
                    voice = voiceResolver.get();
                    LOG.info("Synthesis ready on {} with voice {}", synthesizer.connectionName(), voice);
                    return;
                }
                case INTERRUPTION -> {
                    buffer.clear();
                    return;
                }
                case RESPONSE_START -> buffer.clear();
                case RESPONSE_END -> buffer.flush().ifPresent(c -> speak(c, sink));
                default -> {
                    // forwarded below
                }
            }
        }
        passThrough(frame, sink);
    }

    @Override
    public void onInterruption() {
        generation.incrementAndGet();
        MediaStream<AudioFrame> stream = speaking;
        if (stream != null) {
            stream.close();
        }
    }

    private void speak(String chunk, FrameSink sink) {
        if (chunk.isBlank() || muted.getAsBoolean()) {
            return;
        }
        long turn = generation.get();
        connection.ensureConnected();
        LOG.debug("Synthesizing \"{}\"", LogSanitizer.preview(chunk, LOG_PREVIEW_CHARS));
        MediaStream<AudioFrame> stream = synthesizer.speak(chunk, voice);
        speaking = stream;
        try {
            Optional<AudioFrame> audio;
            while (generation.get() == turn && (audio = stream.next()).isPresent()) {
                if (generation.get() != turn) {
                    break;
                }
                sink.push(audio.get());
            }
        } catch (UpstreamServiceException e) {
            if (generation.get() == turn) {
                throw e;
            }
            LOG.debug("Synthesis stream closed by interruption");
        } finally {
            speaking = null;
            stream.close();
        }
    }

    @Override
    public void close() {
        MediaStream<AudioFrame> stream = speaking;
        if (stream != null) {
            stream.close();
        }
    }
}
