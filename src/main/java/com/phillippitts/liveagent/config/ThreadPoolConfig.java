package com.phillippitts.liveagent.config;

import com.phillippitts.liveagent.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for pipeline sessions.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for stage loops and stream reader tasks.
     *
     * <p>Every task blocks for the lifetime of its session, so the pool has no queue: a
     * submitted task either gets a thread or is rejected with
     * {@link ThreadPoolExecutor.AbortPolicy}. Running a stage loop on the caller thread would
     * stall the caller for the whole call.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext (sessionId, callId) from the submitting
     * thread so stage logs stay correlated.
     *
     * @return executor for stage runners
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        return buildExecutor(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Bounded executor for short CPU-bound jobs: snapshot encoding and best-effort avatar teardown.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue are
     * full the submitting thread does the work, providing backpressure instead of dropping it.
     *
     * @return executor for media jobs
     */
    @Bean(name = "mediaExecutor")
    public Executor mediaExecutor() {
        return buildExecutor(threadPoolProperties.getMedia(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                          java.util.concurrent.RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /** Copies the submitter's ThreadContext into the worker and restores the worker's afterwards. */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
