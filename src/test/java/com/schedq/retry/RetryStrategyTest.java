package com.schedq.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryStrategyTest {

    private static final RuntimeException FAILURE = new RuntimeException("boom");

    @Test
    void shouldNeverRetryWithNoneStrategy() {
        RetryStrategy strategy = RetryStrategy.none();

        assertFalse(strategy.shouldRetry(FAILURE, 1));
        assertEquals(Duration.ZERO, strategy.getDelay(1));
    }

    @Test
    void shouldRetryUntilAttemptReachesMaxRetries() {
        RetryStrategy strategy = RetryStrategy.fixed(3, Duration.ofSeconds(10));

        assertTrue(strategy.shouldRetry(FAILURE, 1));
        assertTrue(strategy.shouldRetry(FAILURE, 2));
        assertFalse(strategy.shouldRetry(FAILURE, 3));
        assertFalse(strategy.shouldRetry(FAILURE, 4));
    }

    @Test
    void shouldReturnSameDelayForEveryAttemptWithFixedStrategy() {
        RetryStrategy strategy = RetryStrategy.fixed(5, Duration.ofSeconds(10));

        assertThat(strategy.getDelay(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(strategy.getDelay(4)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldDoubleDelayWithoutJitter() {
        RetryStrategy strategy = RetryStrategy.exponential(5, Duration.ofSeconds(1), 2.0, Duration.ofHours(1), false);

        assertThat(strategy.getDelay(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(strategy.getDelay(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(strategy.getDelay(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(strategy.getDelay(4)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void shouldCapExponentialDelayAtMaxDelay() {
        RetryStrategy strategy = RetryStrategy.exponential(50, Duration.ofSeconds(1), 2.0, Duration.ofMinutes(1), false);

        assertThat(strategy.getDelay(7)).isEqualTo(Duration.ofMinutes(1));
        assertThat(strategy.getDelay(40)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void shouldKeepJitteredDelayWithinTwentyPercent() {
        ExponentialRetryStrategy strategy = ((ExponentialRetryStrategy) RetryStrategy.exponential(5, Duration.ofSeconds(10)))
                .withRandom(new Random(42));

        for (int i = 0; i < 100; i++) {
            assertThat(strategy.getDelay(1)).isBetween(Duration.ofSeconds(8), Duration.ofSeconds(12));
            assertThat(strategy.getDelay(2)).isBetween(Duration.ofSeconds(16), Duration.ofSeconds(24));
        }
    }

    @Test
    void shouldDrawJitterFromSuppliedRandom() {
        ExponentialRetryStrategy first = ((ExponentialRetryStrategy) RetryStrategy.exponential(5, Duration.ofSeconds(10)))
                .withRandom(new Random(7));
        ExponentialRetryStrategy second = ((ExponentialRetryStrategy) RetryStrategy.exponential(5, Duration.ofSeconds(10)))
                .withRandom(new Random(7));

        assertThat(first.getDelay(3)).isEqualTo(second.getDelay(3));
    }

    @Test
    void shouldRejectFactorBelowOne() {
        assertThatThrownBy(() -> RetryStrategy.exponential(3, Duration.ofSeconds(1), 0.5, null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("factor");
    }

    @Test
    void shouldGrowLinearly() {
        RetryStrategy strategy = RetryStrategy.linear(5, Duration.ofSeconds(5), Duration.ofSeconds(10));

        assertThat(strategy.getDelay(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(strategy.getDelay(2)).isEqualTo(Duration.ofSeconds(15));
        assertThat(strategy.getDelay(3)).isEqualTo(Duration.ofSeconds(25));
    }

    @Test
    void shouldCapDefaultExponentialDelayAtFiveMinutesBeforeJitter() {
        ExponentialRetryStrategy strategy = ((ExponentialRetryStrategy) RetryStrategy.exponential(10, Duration.ofSeconds(10)))
                .withRandom(new Random(42));

        for (int attempt = 6; attempt <= 9; attempt++) {
            assertThat(strategy.getDelay(attempt)).isBetween(Duration.ofSeconds(240), Duration.ofSeconds(360));
        }
    }

    @Test
    void shouldNotCapLinearDelayByDefault() {
        RetryStrategy strategy = RetryStrategy.linear(1000, Duration.ofSeconds(10), Duration.ofMinutes(10));

        assertThat(strategy.getDelay(10)).isEqualTo(Duration.ofSeconds(10).plus(Duration.ofMinutes(90)));
    }

    @Test
    void shouldCapLinearDelay() {
        RetryStrategy strategy = RetryStrategy.linear(10, Duration.ofSeconds(5), Duration.ofSeconds(10),
                Duration.ofSeconds(20), false);

        assertThat(strategy.getDelay(5)).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void shouldUseCustomDelayFunction() {
        RetryStrategy strategy = RetryStrategy.custom(4, attempt -> Duration.ofMillis(attempt * 250L));

        assertThat(strategy.getDelay(2)).isEqualTo(Duration.ofMillis(500));
        assertTrue(strategy.shouldRetry(FAILURE, 3));
        assertFalse(strategy.shouldRetry(FAILURE, 4));
    }

    @Test
    void shouldFailWhenCustomFunctionReturnsNull() {
        RetryStrategy strategy = RetryStrategy.custom(2, attempt -> null);

        assertThatThrownBy(() -> strategy.getDelay(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectAttemptBelowOne() {
        assertThatThrownBy(() -> RetryStrategy.fixed(3, Duration.ZERO).getDelay(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Attempt numbers start at 1");
    }

    @Test
    void shouldRejectNegativeValues() {
        assertThatThrownBy(() -> RetryStrategy.fixed(-1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryStrategy.fixed(1, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOnlyRetryListedExceptions() {
        RetryStrategy strategy = RetryStrategy.fixed(3, Duration.ZERO).retryOn(UncheckedIOException.class);

        assertTrue(strategy.shouldRetry(new UncheckedIOException(new IOException("disk")), 1));
        assertFalse(strategy.shouldRetry(new IllegalStateException("nope"), 1));
    }

    @Test
    void shouldNeverRetryIgnoredExceptionsEvenIfListed() {
        RetryStrategy strategy = RetryStrategy.fixed(3, Duration.ZERO)
                .retryOn(RuntimeException.class)
                .ignoreOn(IllegalArgumentException.class);

        assertFalse(strategy.shouldRetry(new IllegalArgumentException("bad input"), 1));
        assertTrue(strategy.shouldRetry(new IllegalStateException("transient"), 1));
        assertThat(strategy).isInstanceOf(FixedRetryStrategy.class);
        assertThat(((FixedRetryStrategy) strategy).getDelay()).isEqualTo(Duration.ZERO);
    }
}
