package com.schedq.retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.IntFunction;

/**
 * Decides whether a failed attempt is retried and how long to wait before the next one.
 * <p>
 * {@code maxRetries} is the highest attempt number (1-based) after which a retry is still
 * allowed: with {@code maxRetries = 3}, failures of attempts 1 and 2 are retried and a
 * failure of attempt 3 is final. Exception filters are checked before the attempt count:
 * a failure matching {@code ignoreOn} is never retried, and when {@code retryOn} is
 * non-empty only matching failures are retried.
 * <p>
 * Strategies are immutable; {@link #retryOn(Class[])} and {@link #ignoreOn(Class[])}
 * return copies.
 */
public abstract class RetryStrategy {

    private final int maxRetries;
    private final List<Class<? extends Throwable>> retryOn;
    private final List<Class<? extends Throwable>> ignoreOn;

    protected RetryStrategy(int maxRetries,
                            List<Class<? extends Throwable>> retryOn,
                            List<Class<? extends Throwable>> ignoreOn) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative but was " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryOn = List.copyOf(retryOn);
        this.ignoreOn = List.copyOf(ignoreOn);
    }

    public boolean shouldRetry(Throwable failure, int attempt) {
        if (matches(ignoreOn, failure)) {
            return false;
        }
        if (!retryOn.isEmpty() && !matches(retryOn, failure)) {
            return false;
        }
        return attempt < maxRetries;
    }

    /**
     * Returns the wait before the attempt following failed attempt {@code attempt}.
     *
     * @throws IllegalArgumentException if {@code attempt} is less than 1
     */
    public final Duration getDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1 but was " + attempt);
        }
        return computeDelay(attempt);
    }

    protected abstract Duration computeDelay(int attempt);

    protected abstract RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                          List<Class<? extends Throwable>> ignoreOn);

    @SafeVarargs
    public final RetryStrategy retryOn(Class<? extends Throwable>... types) {
        return copy(Arrays.asList(types), ignoreOn);
    }

    @SafeVarargs
    public final RetryStrategy ignoreOn(Class<? extends Throwable>... types) {
        return copy(retryOn, Arrays.asList(types));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public List<Class<? extends Throwable>> getRetryOn() {
        return retryOn;
    }

    public List<Class<? extends Throwable>> getIgnoreOn() {
        return ignoreOn;
    }

    private static boolean matches(List<Class<? extends Throwable>> types, Throwable failure) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    static Duration jitter(Duration delay, Random random) {
        double factor = 0.8 + random.nextDouble() * 0.4;
        return Duration.ofNanos(Math.round(delay.toNanos() * factor));
    }

    static Duration cap(double nanos, Duration maxDelay) {
        double capped = maxDelay == null ? nanos : Math.min(nanos, maxDelay.toNanos());
        return Duration.ofNanos((long) Math.min(capped, Long.MAX_VALUE));
    }

    static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative but was " + value);
        }
    }

    /**
     * Cap of {@link #exponential(int, Duration)}. Linear strategies are uncapped unless a cap is given.
     */
    public static final Duration DEFAULT_EXPONENTIAL_MAX_DELAY = Duration.ofMinutes(5);

    public static RetryStrategy none() {
        return new NoRetryStrategy();
    }

    public static RetryStrategy fixed(int maxRetries, Duration delay) {
        return new FixedRetryStrategy(maxRetries, delay, List.of(), List.of());
    }

    public static RetryStrategy exponential(int maxRetries, Duration baseDelay) {
        return exponential(maxRetries, baseDelay, 2.0, DEFAULT_EXPONENTIAL_MAX_DELAY, true);
    }

    public static RetryStrategy exponential(int maxRetries, Duration baseDelay, double factor,
                                            Duration maxDelay, boolean jitter) {
        return new ExponentialRetryStrategy(maxRetries, baseDelay, factor, maxDelay, jitter, new Random(),
                List.of(), List.of());
    }

    public static RetryStrategy linear(int maxRetries, Duration initialDelay, Duration increment) {
        return linear(maxRetries, initialDelay, increment, null, false);
    }

    public static RetryStrategy linear(int maxRetries, Duration initialDelay, Duration increment,
                                       Duration maxDelay, boolean jitter) {
        return new LinearRetryStrategy(maxRetries, initialDelay, increment, maxDelay, jitter, new Random(),
                List.of(), List.of());
    }

    public static RetryStrategy custom(int maxRetries, IntFunction<Duration> delayFunction) {
        return new CustomRetryStrategy(maxRetries, delayFunction, List.of(), List.of());
    }
}
