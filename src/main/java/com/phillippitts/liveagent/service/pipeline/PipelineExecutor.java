package com.phillippitts.liveagent.service.pipeline;

import com.phillippitts.liveagent.config.properties.PipelineProperties;
import com.phillippitts.liveagent.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs an ordered list of stages as one session.
 *
 * <p>Each stage gets its own task on the pipeline executor, connected to its neighbours by
 * bounded inboxes. START is driven through all stages first; the session then runs until END has
 * drained through every stage, the session is cancelled, a fatal stage failure occurs, or no
 * activity is reported for the idle timeout.
 */
@Component("pipelineSessionExecutor")
public class PipelineExecutor {

    private static final Logger LOG = LogManager.getLogger(PipelineExecutor.class);

    private final Executor executor;
    private final PipelineProperties properties;
    private final ApplicationEventPublisher publisher;

    public PipelineExecutor(@Qualifier("pipelineExecutor") Executor executor,
                            PipelineProperties properties,
                            ApplicationEventPublisher publisher) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Starts a session and returns immediately.
     *
     * @param sessionId   correlation id used in logs and events
     * @param stages      stages in flow order, capture first and output last
     * @param idleTimeout inactivity limit; zero disables the idle watcher
     * @return handle for queueing frames, cancelling and awaiting the session
     * @throws ConfigurationException if no stages are given
     */
    public PipelineTask start(String sessionId, List<? extends Stage> stages, Duration idleTimeout) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (stages == null || stages.isEmpty()) {
            throw new ConfigurationException("stages", "A pipeline needs at least one stage");
        }
        PipelineTask task = new PipelineTask(sessionId, List.copyOf(stages), properties.getInboxCapacity(),
                executor, publisher);
        if (LOG.isInfoEnabled()) {
            LOG.info("Starting session {} with stages [{}]", sessionId,
                    stages.stream().map(Stage::name).collect(Collectors.joining(" -> ")));
        }
        task.launch(idleTimeout);
        return task;
    }

    /**
     * Starts a session and blocks until it reaches a terminal status.
     */
    public PipelineStatus run(String sessionId, List<? extends Stage> stages, Duration idleTimeout)
            throws InterruptedException {
        return start(sessionId, stages, idleTimeout).await();
    }
}
