package com.phillippitts.liveagent.service.connection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    @Test
    void defaultsDoubleUpToTheCap() {
        assertThat(BackoffPolicy.defaults().baseDelays()).containsExactly(
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofSeconds(4),
                Duration.ofSeconds(8),
                Duration.ofSeconds(8));
    }

    @Test
    void floorsAreApplied() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(50), 0, 3.0);

        assertThat(policy.initialDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.maxDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.maxAttempts()).isEqualTo(1);
        assertThat(policy.jitterRatio()).isEqualTo(1.0);
    }

    @Test
    void jitterStaysWithinHalfTheBaseDelay() {
        BackoffPolicy policy = BackoffPolicy.defaults();
        Duration base = Duration.ofSeconds(2);

        assertThat(policy.jittered(base, 0.0)).isEqualTo(base);
        assertThat(policy.jittered(base, 0.999)).isLessThan(Duration.ofSeconds(3));
        assertThat(policy.jittered(base, 0.5)).isEqualTo(Duration.ofMillis(2500));
    }
}
