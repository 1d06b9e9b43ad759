package com.phillippitts.liveagent.service.pipeline.event;

import com.phillippitts.liveagent.service.pipeline.PipelineStatus;

import java.time.Instant;

/** Published once per session when its pipeline reaches a terminal status. */
public record PipelineFinishedEvent(String sessionId, PipelineStatus status, long durationMillis, Instant at) { }
