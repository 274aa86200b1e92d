package com.schedq.retry;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Waits {@code baseDelay * factor^(attempt - 1)}, capped at {@code maxDelay}. With jitter
 * enabled the capped value is spread by up to 20% either way.
 */
public final class ExponentialRetryStrategy extends RetryStrategy {

    private final Duration baseDelay;
    private final double factor;
    private final Duration maxDelay;
    private final boolean jitter;
    private final Random random;

    ExponentialRetryStrategy(int maxRetries, Duration baseDelay, double factor, Duration maxDelay,
                             boolean jitter, Random random,
                             List<Class<? extends Throwable>> retryOn,
                             List<Class<? extends Throwable>> ignoreOn) {
        super(maxRetries, retryOn, ignoreOn);
        requireNonNegative("baseDelay", baseDelay);
        if (maxDelay != null) {
            requireNonNegative("maxDelay", maxDelay);
        }
        if (factor < 1.0 || Double.isNaN(factor)) {
            throw new IllegalArgumentException("Backoff factor must be at least 1 but was " + factor);
        }
        this.baseDelay = baseDelay;
        this.factor = factor;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    protected Duration computeDelay(int attempt) {
        double nanos = baseDelay.toNanos() * Math.pow(factor, attempt - 1);
        Duration delay = cap(nanos, maxDelay);
        return jitter ? jitter(delay, random) : delay;
    }

    @Override
    protected RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                 List<Class<? extends Throwable>> ignoreOn) {
        return new ExponentialRetryStrategy(getMaxRetries(), baseDelay, factor, maxDelay, jitter, random,
                retryOn, ignoreOn);
    }

    /**
     * Returns a copy drawing its jitter from {@code random}.
     */
    public ExponentialRetryStrategy withRandom(Random random) {
        return new ExponentialRetryStrategy(getMaxRetries(), baseDelay, factor, maxDelay, jitter, random,
                getRetryOn(), getIgnoreOn());
    }

    @Override
    public String toString() {
        return "exponential[" + getMaxRetries() + ", " + baseDelay + " x" + factor + "]";
    }
}
