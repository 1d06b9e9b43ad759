package com.phillippitts.liveagent.testutil;

import com.phillippitts.liveagent.domain.AudioFrame;
import com.phillippitts.liveagent.exception.UpstreamServiceException;
import com.phillippitts.liveagent.service.recognition.RecognitionEvent;
import com.phillippitts.liveagent.service.recognition.RecognitionSession;
import com.phillippitts.liveagent.service.recognition.SpeechRecognitionService;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Recognizer whose events are emitted by the test with {@link #emit}.
 */
public final class FakeRecognizer implements SpeechRecognitionService {

    private static final RecognitionEvent CLOSED = RecognitionEvent.partial("\u0000closed");

    private final BlockingQueue<RecognitionEvent> events = new LinkedBlockingQueue<>();
    private final List<AudioFrame> submitted = new CopyOnWriteArrayList<>();
    private volatile boolean failOpen;
    private volatile boolean opened;
    private volatile boolean closed;

    public void emit(RecognitionEvent event) {
        events.add(event);
    }

    /** Simulates the participant saying {@code text}: speech start, then a final transcript. */
    public void says(String text) {
        emit(RecognitionEvent.speechStarted());
        emit(RecognitionEvent.finalTranscript(text));
    }

    public void failOpen() {
        failOpen = true;
    }

    public List<AudioFrame> submitted() {
        return List.copyOf(submitted);
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String name() {
        return "fake-stt";
    }

    @Override
    public RecognitionSession open(String sessionId) {
        if (failOpen) {
            throw new UpstreamServiceException(name(), "401 unauthorized");
        }
        opened = true;
        return new RecognitionSession() {
            @Override
            public void submit(AudioFrame audio) {
                submitted.add(audio);
            }

            @Override
            public Optional<RecognitionEvent> next() {
                try {
                    RecognitionEvent event = events.take();
                    if (event == CLOSED) {
                        events.add(CLOSED);
                        return Optional.empty();
                    }
                    return Optional.of(event);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }

            @Override
            public void close() {
                closed = true;
                events.add(CLOSED);
            }
        };
    }
}
