package com.phillippitts.liveagent.service.session.event;

import com.phillippitts.liveagent.service.session.CallSummary;

import java.time.Instant;

/**
 * Published after a call has finished and its summary was reported.
 */
public record CallCompletedEvent(CallSummary summary, Instant at) {
}
