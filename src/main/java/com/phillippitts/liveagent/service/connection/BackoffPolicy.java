package com.phillippitts.liveagent.service.connection;

import com.phillippitts.liveagent.config.properties.ConnectionProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exponential backoff with bounded random jitter.
 *
 * <p>The base delay starts at {@code initialDelay} and doubles after every failed attempt, capped
 * at {@code maxDelay}. The actual sleep adds {@code uniform(0, base * jitterRatio)}.
 *
 * @param initialDelay first base delay, at least 100ms
 * @param maxDelay     delay cap, never below {@code initialDelay}
 * @param maxAttempts  connection attempts per {@code ensureConnected} call, at least 1
 * @param jitterRatio  jitter bound as a fraction of the base delay, 0..1
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, int maxAttempts, double jitterRatio) {

    static final Duration MIN_INITIAL_DELAY = Duration.ofMillis(100);

    public BackoffPolicy {
        if (initialDelay == null || initialDelay.compareTo(MIN_INITIAL_DELAY) < 0) {
            initialDelay = MIN_INITIAL_DELAY;
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            maxDelay = initialDelay;
        }
        maxAttempts = Math.max(1, maxAttempts);
        jitterRatio = Math.max(0.0, Math.min(1.0, jitterRatio));
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(8), 6, 0.5);
    }

    public static BackoffPolicy from(ConnectionProperties props) {
        return new BackoffPolicy(props.getInitialDelay(), props.getMaxDelay(), props.getMaxAttempts(),
                props.getJitterRatio());
    }

    /**
     * Base delay after the given failed attempt (1-based), before jitter.
     */
    public Duration baseDelay(int attempt) {
        Duration delay = initialDelay;
        for (int i = 1; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay;
    }

    /**
     * Base delays for every attempt slot, e.g. 0.5, 1, 2, 4, 8, 8 seconds for the defaults.
     */
    public List<Duration> baseDelays() {
        List<Duration> delays = new ArrayList<>(maxAttempts);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            delays.add(baseDelay(attempt));
        }
        return delays;
    }

    /**
     * Base delay plus jitter.
     *
     * @param unitRandom a value in [0, 1)
     */
    public Duration jittered(Duration base, double unitRandom) {
        long jitterNanos = (long) (base.toNanos() * jitterRatio * unitRandom);
        return base.plusNanos(jitterNanos);
    }
}
