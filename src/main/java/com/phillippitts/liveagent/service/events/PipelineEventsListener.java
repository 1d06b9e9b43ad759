package com.phillippitts.liveagent.service.events;

import com.phillippitts.liveagent.service.audio.event.BackgroundMixDisabledEvent;
import com.phillippitts.liveagent.service.avatar.event.AvatarDegradedEvent;
import com.phillippitts.liveagent.service.connection.event.ConnectionAttemptFailedEvent;
import com.phillippitts.liveagent.service.connection.event.ConnectionExhaustedEvent;
import com.phillippitts.liveagent.service.metrics.PipelineMetrics;
import com.phillippitts.liveagent.service.pipeline.event.PipelineFinishedEvent;
import com.phillippitts.liveagent.service.pipeline.event.StageFailureEvent;
import com.phillippitts.liveagent.service.session.event.CallCompletedEvent;
import com.phillippitts.liveagent.service.vision.event.SnapshotAttachmentEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records pipeline events as metrics and logs the operator-relevant ones. Logging is throttled
 * per key so a flapping dependency cannot flood the log.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final PipelineMetrics metrics;

    PipelineEventsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onStageFailure(StageFailureEvent e) {
        metrics.incrementStageFailure(e.stage(), e.fatal());
        if (e.fatal() || shouldLog("stage-" + e.errorTag())) {
            LOG.warn("Stage failure: tag={}, fatal={}, session={}", e.errorTag(), e.fatal(), e.sessionId());
        }
    }

    @EventListener
    void onConnectAttemptFailed(ConnectionAttemptFailedEvent e) {
        metrics.incrementConnectAttemptFailure(e.service());
    }

    @EventListener
    void onConnectionExhausted(ConnectionExhaustedEvent e) {
        metrics.incrementConnectionExhausted(e.service());
        if (shouldLog("connection-" + e.service())) {
            LOG.error("Gave up connecting to {} after {} attempts: {}. Check service availability and rate limits.",
                    e.service(), e.attempts(), e.lastError());
        }
    }

    @EventListener
    void onAvatarDegraded(AvatarDegradedEvent e) {
        metrics.incrementAvatarDegraded(e.service());
        if (shouldLog("avatar-" + e.service())) {
            LOG.warn("Avatar {} degraded to audio-only: {}", e.service(), e.reason());
        }
    }

    @EventListener
    void onMixerDisabled(BackgroundMixDisabledEvent e) {
        metrics.incrementMixerDisabled();
        if (shouldLog("mixer")) {
            LOG.warn("Background mixing disabled: {}. Check audio.background.source format.", e.reason());
        }
    }

    @EventListener
    void onSnapshotAttachment(SnapshotAttachmentEvent e) {
        metrics.incrementSnapshotAttachment(e.outcome());
    }

    @EventListener
    void onPipelineFinished(PipelineFinishedEvent e) {
        metrics.recordSessionFinished(e.status(), e.durationMillis());
    }

    @EventListener
    void onCallCompleted(CallCompletedEvent e) {
        LOG.debug("Call {} completed with status {}", e.summary().callId(), e.summary().status());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
