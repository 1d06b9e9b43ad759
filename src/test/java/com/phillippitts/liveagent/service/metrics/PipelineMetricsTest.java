package com.phillippitts.liveagent.service.metrics;

import com.phillippitts.liveagent.service.pipeline.PipelineStatus;
import com.phillippitts.liveagent.service.vision.AttachmentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private MeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void shouldRecordSessionDurationPerStatus() {
        metrics.recordSessionFinished(PipelineStatus.COMPLETED, 90_000);
        metrics.recordSessionFinished(PipelineStatus.COMPLETED, 30_000);
        metrics.recordSessionFinished(PipelineStatus.IDLE_TIMEOUT, 300_000);

        Timer completed = registry.find("liveagent.session.duration").tag("status", "completed").timer();
        Timer idle = registry.find("liveagent.session.duration").tag("status", "idle_timeout").timer();

        assertThat(completed).isNotNull();
        assertThat(completed.count()).isEqualTo(2);
        assertThat(completed.totalTime(TimeUnit.SECONDS)).isEqualTo(120.0);
        assertThat(idle).isNotNull();
        assertThat(idle.count()).isEqualTo(1);
    }

    @Test
    void shouldSplitStageFailuresByFatality() {
        metrics.incrementStageFailure("synthesis", false);
        metrics.incrementStageFailure("synthesis", false);
        metrics.incrementStageFailure("transport-output", true);

        Counter recoverable = registry.find("liveagent.stage.failure")
                .tag("stage", "synthesis").tag("fatal", "false").counter();
        Counter fatal = registry.find("liveagent.stage.failure")
                .tag("stage", "transport-output").tag("fatal", "true").counter();

        assertThat(recoverable.count()).isEqualTo(2.0);
        assertThat(fatal.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountConnectionFailuresPerService() {
        metrics.incrementConnectAttemptFailure("tts");
        metrics.incrementConnectAttemptFailure("tts");
        metrics.incrementConnectionExhausted("tts");

        assertThat(registry.find("liveagent.connection.attempt.failure").tag("service", "tts").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("liveagent.connection.exhausted").tag("service", "tts").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountDegradesMixerShutdownsAndSnapshotOutcomes() {
        metrics.incrementAvatarDegraded("heygen");
        metrics.incrementMixerDisabled();
        metrics.incrementSnapshotAttachment(AttachmentOutcome.STALE);

        assertThat(registry.find("liveagent.avatar.degraded").tag("service", "heygen").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("liveagent.mixer.disabled").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("liveagent.vision.attachment").tag("outcome", "stale").counter().count())
                .isEqualTo(1.0);
    }
}
