package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.config.properties.PipelineProperties;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.exception.ConfigurationException;
import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.service.pipeline.event.PipelineFinishedEvent;
import com.phillippitts.liveagent.service.pipeline.event.StageFailureEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PipelineExecutorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final List<Object> events = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(2, TimeUnit.SECONDS);
    }

    private PipelineExecutor executor(int inboxCapacity) {
        PipelineProperties properties = new PipelineProperties();
        properties.setInboxCapacity(inboxCapacity);
        return new PipelineExecutor(pool, properties, events::add);
    }

    private PipelineTask start(List<? extends Stage> stages) {
        return executor(8).start("s-1", stages, Duration.ZERO);
    }

    private <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    @Test
    void endDrainsThroughEveryStageAndCompletes() throws Exception {
        RecordingStage capture = new RecordingStage("capture");
        RecordingStage middle = new RecordingStage("middle");
        RecordingStage output = new RecordingStage("output");
        PipelineTask task = start(List.of(capture, middle, output));

        task.queueFrame(TextFrame.transcript("hello", true));
        task.queueFrame(ControlFrame.of(ControlType.END));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(output.controls()).containsExactly(ControlType.START, ControlType.END);
        assertThat(output.texts()).containsExactly("hello");
        assertThat(List.of(capture, middle, output)).allMatch(RecordingStage::isClosed);
        assertThat(eventsOf(PipelineFinishedEvent.class)).singleElement()
                .extracting(PipelineFinishedEvent::status).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void runBlocksUntilTheSessionEnds() throws Exception {
        Stage endsOnStart = new RecordingStage("capture") {
            @Override
            public void process(Frame frame, FrameSink sink) {
                super.process(frame, sink);
                if (frame instanceof ControlFrame control && control.is(ControlType.START)) {
                    sink.push(ControlFrame.of(ControlType.END));
                }
            }
        };

        PipelineStatus status = executor(8).run("s-run", List.of(endsOnStart, new RecordingStage("out")),
                Duration.ZERO);

        assertThat(status).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void cancelReachesEveryStage() throws Exception {
        RecordingStage first = new RecordingStage("first");
        RecordingStage second = new RecordingStage("second");
        PipelineTask task = start(List.of(first, second));
        await().atMost(WAIT).until(() -> second.controls().contains(ControlType.START));

        task.cancel();

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(first.controls()).contains(ControlType.CANCEL);
        assertThat(second.controls()).contains(ControlType.CANCEL);
        assertThat(second.isClosed()).isTrue();
    }

    @Test
    void middleStageFailureBecomesUpstreamErrorAndTheFrameContinues() throws Exception {
        RecordingStage capture = new RecordingStage("capture");
        RecordingStage failing = new FailingStage("nlp", text -> text.equals("boom"),
                () -> new IllegalStateException("bad token"));
        RecordingStage output = new RecordingStage("output");
        PipelineTask task = start(List.of(capture, failing, output));

        task.queueFrame(TextFrame.transcript("boom", true));
        task.queueFrame(TextFrame.transcript("fine", true));
        await().atMost(WAIT).until(() -> !capture.errorTags().isEmpty());
        task.queueFrame(ControlFrame.of(ControlType.END));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(output.texts()).containsExactly("boom", "fine");
        assertThat(capture.errorTags()).containsExactly("nlp:IllegalStateException");
        assertThat(eventsOf(StageFailureEvent.class)).singleElement()
                .satisfies(event -> {
                    assertThat(event.stage()).isEqualTo("nlp");
                    assertThat(event.fatal()).isFalse();
                });
    }

    @Test
    void frameAlreadyPushedBeforeAFailureIsNotForwardedAgain() throws Exception {
        RecordingStage capture = new RecordingStage("capture");
        Stage pushesThenFails = new RecordingStage("tts") {
            @Override
            public void process(Frame frame, FrameSink sink) {
                super.process(frame, sink);
                if (frame instanceof TextFrame) {
                    throw new ConnectionException("tts", 6, "exhausted");
                }
            }
        };
        RecordingStage output = new RecordingStage("output");
        PipelineTask task = start(List.of(capture, pushesThenFails, output));

        task.queueFrame(TextFrame.assistant("Hi."));
        await().atMost(WAIT).until(() -> !capture.errorTags().isEmpty());
        task.queueFrame(ControlFrame.of(ControlType.END));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(output.texts()).containsExactly("Hi.");
        assertThat(capture.errorTags()).containsExactly("tts:ConnectionException");
    }

    @Test
    void captureFailureIsFatal() throws Exception {
        RecordingStage capture = new FailingStage("capture", text -> true,
                () -> new IllegalStateException("device lost"));
        RecordingStage output = new RecordingStage("output");
        PipelineTask task = start(List.of(capture, output));

        task.queueFrame(TextFrame.transcript("x", true));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(output.texts()).isEmpty();
        assertThat(eventsOf(StageFailureEvent.class)).singleElement()
                .extracting(StageFailureEvent::fatal).isEqualTo(true);
    }

    @Test
    void configurationFailureAnywhereIsFatal() throws Exception {
        RecordingStage middle = new FailingStage("tools", text -> true,
                () -> new ConfigurationException("tools.endpoint", "missing"));
        PipelineTask task = start(List.of(new RecordingStage("in"), middle, new RecordingStage("out")));

        task.queueFrame(TextFrame.transcript("x", true));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.FAILED);
    }

    @Test
    void connectionFailureDuringStartIsFatal() throws Exception {
        Stage tts = new RecordingStage("tts") {
            @Override
            public void process(Frame frame, FrameSink sink) {
                if (frame instanceof ControlFrame control && control.is(ControlType.START)) {
                    throw new ConnectionException("tts", 6, "exhausted");
                }
                super.process(frame, sink);
            }
        };
        PipelineTask task = start(List.of(new RecordingStage("in"), tts, new RecordingStage("out")));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.FAILED);
    }

    @Test
    void fullInboxBlocksTheProducer() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingStage capture = new RecordingStage("capture");
        GatedStage output = new GatedStage("output", gate, text -> true);
        PipelineTask task = executor(2).start("s-bp", List.of(capture, output), Duration.ZERO);
        AtomicInteger queued = new AtomicInteger();

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 20; i++) {
                task.queueFrame(TextFrame.transcript("f" + i, true));
                queued.incrementAndGet();
            }
        });
        producer.start();

        await().pollDelay(Duration.ofMillis(300)).atMost(WAIT).until(() -> true);
        assertThat(producer.isAlive()).isTrue();
        assertThat(queued.get()).isLessThan(20);

        gate.countDown();
        producer.join(WAIT.toMillis());
        assertThat(producer.isAlive()).isFalse();
        task.queueFrame(ControlFrame.of(ControlType.END));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(output.texts()).hasSize(20);
    }

    @Test
    void interruptionDiscardsQueuedDataAndNotifiesEveryStage() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        RecordingStage capture = new RecordingStage("capture");
        GatedStage slow = new GatedStage("slow", gate, text -> text.equals("a"));
        RecordingStage output = new RecordingStage("output");
        PipelineTask task = start(List.of(capture, slow, output));

        task.queueFrame(TextFrame.transcript("a", true));
        task.queueFrame(TextFrame.transcript("b", true));
        task.queueFrame(TextFrame.transcript("c", true));
        await().atMost(WAIT).until(() -> capture.texts().contains("c"));

        task.queueFrame(ControlFrame.of(ControlType.INTERRUPTION));
        task.queueFrame(TextFrame.transcript("d", true));
        task.queueFrame(ControlFrame.of(ControlType.END));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(output.texts()).contains("d").doesNotContain("b", "c");
        assertThat(output.controls()).contains(ControlType.INTERRUPTION);
        assertThat(List.of(capture, slow, output)).allMatch(stage -> stage.interruptions() >= 1)
                .allMatch(stage -> stage.controls().contains(ControlType.INTERRUPTION));
    }

    @Test
    void inactiveSessionTimesOut() throws Exception {
        PipelineTask task = executor(8).start("s-idle",
                List.of(new RecordingStage("in"), new RecordingStage("out")), Duration.ofMillis(200));

        assertThat(task.await(WAIT)).isTrue();
        assertThat(task.status()).isEqualTo(PipelineStatus.IDLE_TIMEOUT);
    }

    @Test
    void zeroIdleTimeoutDisablesTheWatcher() throws Exception {
        PipelineTask task = start(List.of(new RecordingStage("in"), new RecordingStage("out")));

        assertThat(task.await(Duration.ofMillis(300))).isFalse();
        task.cancel();
        assertThat(task.await(WAIT)).isTrue();
    }

    @Test
    void rejectsEmptyStageList() {
        assertThatThrownBy(() -> start(List.of()))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getParameter()).isEqualTo("stages"));
    }

    /** Records what it sees and passes everything on. */
    static class RecordingStage extends AbstractStage {

        private final List<Frame> seen = new CopyOnWriteArrayList<>();
        private final AtomicInteger interruptions = new AtomicInteger();
        private volatile boolean closed;

        RecordingStage(String name) {
            super(name);
        }

        @Override
        public void process(Frame frame, FrameSink sink) {
            seen.add(frame);
            passThrough(frame, sink);
        }

        @Override
        public void onInterruption() {
            interruptions.incrementAndGet();
        }

        @Override
        public void close() {
            closed = true;
        }

        List<ControlType> controls() {
            return seen.stream().filter(ControlFrame.class::isInstance)
                    .map(f -> ((ControlFrame) f).type()).collect(Collectors.toList());
        }

        List<String> texts() {
            return seen.stream().filter(TextFrame.class::isInstance)
                    .map(f -> ((TextFrame) f).text()).collect(Collectors.toList());
        }

        List<String> errorTags() {
            return seen.stream().filter(ControlFrame.class::isInstance).map(ControlFrame.class::cast)
                    .filter(c -> c.is(ControlType.ERROR)).map(ControlFrame::errorTag)
                    .collect(Collectors.toList());
        }

        int interruptions() {
            return interruptions.get();
        }

        boolean isClosed() {
            return closed;
        }
    }

    static class FailingStage extends RecordingStage {

        private final Predicate<String> failOn;
        private final Supplier<RuntimeException> failure;

        FailingStage(String name, Predicate<String> failOn, Supplier<RuntimeException> failure) {
            super(name);
            this.failOn = failOn;
            this.failure = failure;
        }

        @Override
        public void process(Frame frame, FrameSink sink) {
            if (frame instanceof TextFrame text && failOn.test(text.text())) {
                throw failure.get();
            }
            super.process(frame, sink);
        }
    }

    /** Holds matching text frames until the gate opens; interruption opens it. */
    static class GatedStage extends RecordingStage {

        private final CountDownLatch gate;
        private final Predicate<String> holds;

        GatedStage(String name, CountDownLatch gate, Predicate<String> holds) {
            super(name);
            this.gate = gate;
            this.holds = holds;
        }

        @Override
        public void process(Frame frame, FrameSink sink) {
            if (frame instanceof TextFrame text && holds.test(text.text())) {
                try {
                    gate.await(WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            super.process(frame, sink);
        }

        @Override
        public void onInterruption() {
            super.onInterruption();
            gate.countDown();
        }
    }
}
