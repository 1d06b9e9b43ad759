package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.exception.SessionNotFoundException;
import com.phillippitts.liveagent.service.pipeline.PipelineExecutor;
import com.phillippitts.liveagent.service.pipeline.PipelineStatus;
import com.phillippitts.liveagent.service.pipeline.PipelineTask;
import com.phillippitts.liveagent.service.session.event.CallCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Starts calls and reports them when they end.
 *
 * <p>Each call is registered while it runs. A watcher task waits for the pipeline to finish,
 * builds the {@link CallSummary}, hands it to every {@link CallOutcomeReporter}, publishes a
 * {@link CallCompletedEvent} and unregisters the call.
 */
@Service
public class CallSessionService {

    private static final Logger LOG = LogManager.getLogger(CallSessionService.class);
    static final int SUMMARY_TURNS = 10;

    private final CallSessionFactory factory;
    private final PipelineExecutor pipelineExecutor;
    private final SessionRegistry registry;
    private final Executor watcherExecutor;
    private final List<TranscriptSink> transcriptSinks;
    private final List<CallOutcomeReporter> reporters;
    private final ApplicationEventPublisher publisher;

    public CallSessionService(CallSessionFactory factory,
                              PipelineExecutor pipelineExecutor,
                              SessionRegistry registry,
                              @Qualifier("pipelineExecutor") Executor watcherExecutor,
                              ObjectProvider<TranscriptSink> transcriptSinks,
                              ObjectProvider<CallOutcomeReporter> reporters,
                              ApplicationEventPublisher publisher) {
        this.factory = factory;
        this.pipelineExecutor = pipelineExecutor;
        this.registry = registry;
        this.watcherExecutor = watcherExecutor;
        this.transcriptSinks = transcriptSinks.orderedStream().collect(Collectors.toUnmodifiableList());
        this.reporters = reporters.orderedStream().collect(Collectors.toUnmodifiableList());
        this.publisher = publisher;
    }

    /**
     * Builds and starts a call.
     *
     * @throws com.phillippitts.liveagent.exception.ConfigurationException if the call is misconfigured;
     *         nothing has been opened in that case
     */
    public CallSession start(CallSessionRequest request, SessionCollaborators collaborators) {
        String sessionId = UUID.randomUUID().toString();
        String callId = request.callId() != null ? request.callId() : sessionId;
        ThreadContext.put("sessionId", sessionId);
        ThreadContext.put("callId", callId);
        try {
            CallOutcome outcome = new CallOutcome();
            SessionPipeline pipeline = factory.build(sessionId, request, collaborators, outcome);
            for (TranscriptSink sink : transcriptSinks) {
                pipeline.conversation().addTurnListener((role, text) -> sink.record(sessionId, role, text));
            }
            PipelineTask task = pipelineExecutor.start(sessionId, pipeline.stages(), pipeline.idleTimeout());
            CallSession session = new CallSession(sessionId, callId, task, pipeline, outcome);
            registry.register(session);
            watcherExecutor.execute(() -> awaitAndReport(session));
            LOG.info("Call {} started as session {} (avatar: {}, idle timeout: {})", callId, sessionId,
                    pipeline.avatar() != null, pipeline.idleTimeout());
            return session;
        } finally {
            ThreadContext.remove("sessionId");
            ThreadContext.remove("callId");
        }
    }

    /**
     * Cancels a running call.
     *
     * @throws SessionNotFoundException if no call with that id is running
     */
    public CallSession stop(String sessionId) {
        CallSession session = find(sessionId);
        LOG.info("Stopping session {} on request", sessionId);
        session.task().cancel();
        return session;
    }

    /**
     * @throws SessionNotFoundException if no call with that id is running
     */
    public CallSession find(String sessionId) {
        return registry.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Collection<CallSession> activeSessions() {
        return registry.all();
    }

    private void awaitAndReport(CallSession session) {
        ThreadContext.put("sessionId", session.sessionId());
        ThreadContext.put("callId", session.callId());
        try {
            PipelineStatus status = session.task().await();
            CallSummary summary = summarize(session, status);
            for (CallOutcomeReporter reporter : reporters) {
                try {
                    reporter.report(summary);
                } catch (RuntimeException e) {
                    LOG.warn("Call outcome reporter {} failed for call {}", reporter.getClass().getSimpleName(),
                            session.callId(), e);
                }
            }
            publisher.publishEvent(new CallCompletedEvent(summary, Instant.now()));
            LOG.info("Call {} ended: status={}, duration={}s, transferred={}", summary.callId(), status,
                    summary.duration().toSeconds(), summary.transferred());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for session {}", session.sessionId());
        } finally {
            registry.unregister(session.sessionId());
            ThreadContext.clearAll();
        }
    }

    static CallSummary summarize(CallSession session, PipelineStatus status) {
        return new CallSummary(
                session.callId(),
                session.sessionId(),
                status,
                Duration.between(session.startedAt(), Instant.now()),
                session.outcome().transferred(),
                session.outcome().result(),
                session.conversation().finalTurns(SUMMARY_TURNS));
    }
}
