package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reconnect policy for the streaming synthesis connection.
 *
 * <p>Floors (initial delay 100ms, max delay never below initial, at least one attempt) are
 * applied by {@code BackoffPolicy}, so out-of-range values degrade instead of failing startup.
 */
@ConfigurationProperties(prefix = "synthesis.connect")
@Validated
public class ConnectionProperties {

    @NotNull
    private Duration initialDelay = Duration.ofMillis(500);

    @NotNull
    private Duration maxDelay = Duration.ofSeconds(8);

    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 6;

    /** Upper bound of the random jitter, as a fraction of the current delay. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterRatio = 0.5;

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
        this.jitterRatio = jitterRatio;
    }
}
