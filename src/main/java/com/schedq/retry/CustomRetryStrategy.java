package com.schedq.retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Delegates the delay to a caller-supplied function of the failed attempt number.
 * The returned value is used as is.
 */
public final class CustomRetryStrategy extends RetryStrategy {

    private final IntFunction<Duration> delayFunction;

    CustomRetryStrategy(int maxRetries, IntFunction<Duration> delayFunction,
                        List<Class<? extends Throwable>> retryOn,
                        List<Class<? extends Throwable>> ignoreOn) {
        super(maxRetries, retryOn, ignoreOn);
        this.delayFunction = Objects.requireNonNull(delayFunction, "delayFunction");
    }

    @Override
    protected Duration computeDelay(int attempt) {
        Duration delay = delayFunction.apply(attempt);
        if (delay == null) {
            throw new IllegalStateException("Custom retry delay function returned null for attempt " + attempt);
        }
        return delay;
    }

    @Override
    protected RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                 List<Class<? extends Throwable>> ignoreOn) {
        return new CustomRetryStrategy(getMaxRetries(), delayFunction, retryOn, ignoreOn);
    }

    @Override
    public String toString() {
        return "custom[" + getMaxRetries() + "]";
    }
}
