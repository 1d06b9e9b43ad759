package com.phillippitts.liveagent.service.connection.event;

import java.time.Instant;

/** Published when a resilient connection gives up after its last attempt. */
public record ConnectionExhaustedEvent(String service, int attempts, String lastError, Instant at) { }
