package com.example.crag.infra.resilience;

import com.example.crag.config.CragConfigException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy p = RetryPolicy.defaults();
        assertThat(p.maxAttempts()).isEqualTo(3);
        assertThat(p.baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(p.maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(p.exponentialBase()).isEqualTo(2.0);
        assertThat(p.jitter()).isTrue();
    }

    @Test
    void baseDelayGrowsExponentiallyAndIsCapped() {
        RetryPolicy p = RetryPolicy.defaults();
        assertThat(p.baseDelayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(p.baseDelayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(p.baseDelayFor(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(p.baseDelayFor(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(p.baseDelayFor(500)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void baseDelayIsMonotonic() {
        RetryPolicy p = new RetryPolicy(10, Duration.ofMillis(150), Duration.ofSeconds(7), 1.7, false, null);
        Duration prev = Duration.ZERO;
        for (int attempt = 0; attempt < 40; attempt++) {
            Duration d = p.baseDelayFor(attempt);
            assertThat(d).isGreaterThanOrEqualTo(prev).isLessThanOrEqualTo(p.maxDelay());
            prev = d;
        }
    }

    @Test
    void jitterAddsAtMostAQuarter() {
        RetryPolicy p = RetryPolicy.defaults();
        assertThat(p.delayFor(1, () -> 0.0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(p.delayFor(1, () -> 0.999)).isBetween(Duration.ofSeconds(2), Duration.ofMillis(2500));

        RetryPolicy noJitter = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, false, null);
        assertThat(noJitter.delayFor(1, () -> 0.999)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void defaultPredicateSkipsInterruptsOpenCircuitsAndBadArguments() {
        RetryPolicy p = RetryPolicy.defaults();
        assertThat(p.isRetryable(new IOException("reset"))).isTrue();
        assertThat(p.isRetryable(new RuntimeException("500"))).isTrue();
        assertThat(p.isRetryable(new InterruptedException())).isFalse();
        assertThat(p.isRetryable(new CircuitOpenException("search", Duration.ZERO))).isFalse();
        assertThat(p.isRetryable(new IllegalArgumentException("bad"))).isFalse();
        assertThat(p.isRetryable(null)).isFalse();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> RetryPolicy.defaults().withMaxAttempts(0))
                .isInstanceOf(CragConfigException.class)
                .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO, 2.0, false, null))
                .isInstanceOf(CragConfigException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.5, false, null))
                .isInstanceOf(CragConfigException.class)
                .hasMessageContaining("exponentialBase");
    }
}
