package com.schedq.retry;

import java.time.Duration;
import java.util.List;

public final class NoRetryStrategy extends RetryStrategy {

    NoRetryStrategy() {
        super(0, List.of(), List.of());
    }

    @Override
    public boolean shouldRetry(Throwable failure, int attempt) {
        return false;
    }

    @Override
    protected Duration computeDelay(int attempt) {
        return Duration.ZERO;
    }

    @Override
    protected RetryStrategy copy(List<Class<? extends Throwable>> retryOn,
                                 List<Class<? extends Throwable>> ignoreOn) {
        return this;
    }

    @Override
    public String toString() {
        return "none";
    }
}
