package com.phillippitts.liveagent.service.session;

/**
 * Receives the summary of every finished call, for example to post it to a webhook.
 * Beans implementing this interface are picked up automatically.
 */
public interface CallOutcomeReporter {

    void report(CallSummary summary);
}
