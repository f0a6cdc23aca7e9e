package com.baykanat.socialsync.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for BackoffPolicy: min(2^n * base, max).
 */
class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(1));

    @Test
    @DisplayName("Delay doubles per retry until it reaches the cap")
    void delayDoublesUntilCap() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMinutes(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMinutes(8));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofMinutes(32));
        assertThat(policy.delayFor(6)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Delay is non-decreasing in the retry count and never exceeds the cap")
    void delayIsMonotonic() {
        Duration previous = Duration.ZERO;
        for (int n = 0; n < 80; n++) {
            Duration current = policy.delayFor(n);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            assertThat(current).isLessThanOrEqualTo(Duration.ofHours(1));
            previous = current;
        }
    }

    @Test
    @DisplayName("Base larger than max is rejected")
    void invalidBoundsRejected() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofHours(2), Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
