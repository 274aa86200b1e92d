package com.schedq.retry;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Waits {@code initialDelay + increment * (attempt - 1)}, capped at {@code maxDelay}.
 */
public final class LinearRetryStrategy extends RetryStrategy {

    private final Duration initialDelay;
    private final Duration increment;
    private final Duration maxDelay;
    private final boolean jitter;
    private final Random random;

    LinearRetryStrategy(int maxRetries, Duration initialDelay, Duration increment, Duration maxDelay,
                        boolean jitter, Random random,
                        List<Class<? extends Throwable>> retryOn,
                        List<Class<? extends Throwable>> ignoreOn) {
        super(maxRetries, retryOn, ignoreOn);
        requireNonNegative("initialDelay", initialDelay);
        requireNonNegative("increment", increment);
        if (maxDelay != null) {
            requireNonNegative("maxDelay", maxDelay);
        }
        this.initialDelay = initialDelay;
        this.increment = increment;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    protected Duration computeDelay(int attempt) {
        double nanos = initialDelay.toNanos() + (double) increment.toNanos() * (attempt - 1);
        Duration delay = cap(nanos, maxDelay);
        return jitter ? jitter(delay, random) : delay;
    }

    @Override
    protected RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                 List<Class<? extends Throwable>> ignoreOn) {
        return new LinearRetryStrategy(getMaxRetries(), initialDelay, increment, maxDelay, jitter, random,
                retryOn, ignoreOn);
    }

    public LinearRetryStrategy withRandom(Random random) {
        return new LinearRetryStrategy(getMaxRetries(), initialDelay, increment, maxDelay, jitter, random,
                getRetryOn(), getIgnoreOn());
    }

    @Override
    public String toString() {
        return "linear[" + getMaxRetries() + ", " + initialDelay + " +" + increment + "]";
    }
}
