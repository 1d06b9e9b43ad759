package com.phillippitts.liveagent.service.connection.event;

import java.time.Instant;

/** Published for every failed connection attempt that will be retried. */
public record ConnectionAttemptFailedEvent(String service, int attempt, String reason, Instant at) { }
