package org.geoingest.service.scheduler;

import org.geoingest.models.enums.BackoffMode;
import org.geoingest.models.enums.UpdateFrequency;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void fixedPolicyWaitsTheSameDelayEveryTime() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofMinutes(5));

        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.maxRetriesFor(UpdateFrequency.REAL_TIME)).isEqualTo(3);
        assertThat(policy.maxRetriesFor(UpdateFrequency.ANNUAL)).isEqualTo(3);
    }

    @Test
    void exponentialPolicyDoublesUpToTheCap() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMinutes(5), BackoffMode.EXPONENTIAL, Duration.ofMinutes(30));

        assertThat(policy.nextDelay(1)).isEqualTo(Duration.ofMinutes(5));
        assertThat(policy.nextDelay(2)).isEqualTo(Duration.ofMinutes(10));
        assertThat(policy.nextDelay(3)).isEqualTo(Duration.ofMinutes(20));
        assertThat(policy.nextDelay(4)).isEqualTo(Duration.ofMinutes(30));
        assertThat(policy.nextDelay(60)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void frequencyScaledPolicyGivesFastSourcesMoreRetries() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMinutes(5), BackoffMode.FIXED, Duration.ofMinutes(5), true);

        assertThat(policy.maxRetriesFor(UpdateFrequency.REAL_TIME)).isEqualTo(5);
        assertThat(policy.maxRetriesFor(UpdateFrequency.HIGH_FREQUENCY)).isEqualTo(4);
        assertThat(policy.maxRetriesFor(UpdateFrequency.HOURLY)).isEqualTo(3);
        assertThat(policy.maxRetriesFor(UpdateFrequency.THREE_HOURLY)).isEqualTo(3);
        assertThat(policy.maxRetriesFor(UpdateFrequency.SIX_HOURLY)).isEqualTo(2);
        assertThat(policy.maxRetriesFor(UpdateFrequency.DAILY)).isEqualTo(2);
        assertThat(policy.maxRetriesFor(UpdateFrequency.IRREGULAR)).isEqualTo(2);
        assertThat(policy.maxRetriesFor(UpdateFrequency.WEEKLY)).isEqualTo(1);
        assertThat(policy.maxRetriesFor(UpdateFrequency.ANNUAL)).isEqualTo(1);
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> RetryPolicy.fixed(0, Duration.ofMinutes(5))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.fixed(3, Duration.ofMinutes(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
