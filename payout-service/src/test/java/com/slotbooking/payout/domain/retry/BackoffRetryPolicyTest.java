package com.slotbooking.payout.domain.retry;

import com.slotbooking.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetryPolicyTest {

    @Test
    @DisplayName("1h,6h,24h maps attempts 1..3 to the listed delays")
    void delayFor_followsList() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy("1h,6h,24h", 3);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofHours(6));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofHours(24));
    }

    @Test
    @DisplayName("attempts past the end of the list reuse the last delay")
    void delayFor_repeatsLast() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy(List.of(Duration.ofMinutes(5)), 10);

        assertThat(policy.delayFor(7)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("canRetry allows exactly maxRetries retries")
    void canRetry_boundary() {
        BackoffRetryPolicy policy = new BackoffRetryPolicy("1h,6h,24h", 3);

        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    @DisplayName("parses seconds, minutes and days, ignoring blanks and case")
    void parse_units() {
        assertThat(BackoffRetryPolicy.parse(" 30s, 15M ,, 2d"))
                .containsExactly(Duration.ofSeconds(30), Duration.ofMinutes(15), Duration.ofDays(2));
    }

    @Test
    @DisplayName("rejects unknown units, non-numbers and an empty list")
    void parse_rejectsMalformed() {
        assertThatThrownBy(() -> new BackoffRetryPolicy("1w", 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new BackoffRetryPolicy("abch", 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new BackoffRetryPolicy("0h", 3)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new BackoffRetryPolicy(" , ", 3)).isInstanceOf(ValidationException.class);
    }
}
