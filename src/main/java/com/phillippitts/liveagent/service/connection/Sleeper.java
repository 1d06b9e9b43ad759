package com.phillippitts.liveagent.service.connection;

import java.time.Duration;

/** Backoff sleep, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
