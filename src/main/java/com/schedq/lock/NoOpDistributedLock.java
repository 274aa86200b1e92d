package com.schedq.lock;

import java.time.Duration;

/**
 * Always grants. For single-instance deployments.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean acquire(String key, Duration timeout) {
        return true;
    }

    @Override
    public boolean release(String key) {
        return true;
    }

    @Override
    public boolean extend(String key, Duration timeout) {
        return true;
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
