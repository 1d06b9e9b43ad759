package com.phillippitts.liveagent.service.metrics;

import com.phillippitts.liveagent.service.pipeline.PipelineStatus;
import com.phillippitts.liveagent.service.vision.AttachmentOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for pipeline sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session duration per terminal status</li>
 *   <li>Stage failures per stage, split fatal/recoverable</li>
 *   <li>Connection attempt failures and exhaustion per service</li>
 *   <li>Avatar degrades and background mixer shutdowns</li>
 *   <li>Vision snapshot attachment outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "liveagent";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSessionFinished(PipelineStatus status, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".session.duration")
                .description("Wall-clock length of pipeline sessions")
                .tag("status", tagValue(status.name()))
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void incrementStageFailure(String stage, boolean fatal) {
        Counter.builder(METRIC_PREFIX + ".stage.failure")
                .description("Failures caught at a stage boundary")
                .tag("stage", stage)
                .tag("fatal", Boolean.toString(fatal))
                .register(registry)
                .increment();
    }

    public void incrementConnectAttemptFailure(String service) {
        Counter.builder(METRIC_PREFIX + ".connection.attempt.failure")
                .description("Failed connection attempts that were retried")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void incrementConnectionExhausted(String service) {
        Counter.builder(METRIC_PREFIX + ".connection.exhausted")
                .description("Connections given up after the last attempt")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void incrementAvatarDegraded(String service) {
        Counter.builder(METRIC_PREFIX + ".avatar.degraded")
                .description("Sessions whose avatar fell back to audio-only")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void incrementMixerDisabled() {
        Counter.builder(METRIC_PREFIX + ".mixer.disabled")
                .description("Sessions where background mixing switched itself off")
                .register(registry)
                .increment();
    }

    public void incrementSnapshotAttachment(AttachmentOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".vision.attachment")
                .description("User turns by camera snapshot outcome")
                .tag("outcome", tagValue(outcome.name()))
                .register(registry)
                .increment();
    }

    private static String tagValue(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
