package com.phillippitts.liveagent.service.pipeline.event;

import java.time.Instant;

/** Published when a stage throws; {@code fatal} failures end the session. */
public record StageFailureEvent(String sessionId, String stage, String errorTag, boolean fatal, Instant at) { }
