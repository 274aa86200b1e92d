package com.schedq.retry;

import java.time.Duration;
import java.util.List;

public final class FixedRetryStrategy extends RetryStrategy {

    private final Duration delay;

    FixedRetryStrategy(int maxRetries, Duration delay,
                       List<Class<? extends Throwable>> retryOn,
                       List<Class<? extends Throwable>> ignoreOn) {
        super(maxRetries, retryOn, ignoreOn);
        requireNonNegative("delay", delay);
        this.delay = delay;
    }

    @Override
    protected Duration computeDelay(int attempt) {
        return delay;
    }

    @Override
    protected RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                 List<Class<? extends Throwable>> ignoreOn) {
        return new FixedRetryStrategy(getMaxRetries(), delay, retryOn, ignoreOn);
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return "fixed[" + getMaxRetries() + ", " + delay + "]";
    }
}
