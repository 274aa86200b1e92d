package com.schedq.executor;

import java.time.Duration;

/**
 * Concurrency and time limits for one invocation.
 *
 * @param jobKey       key counted against {@code maxInstances}; {@code null} for unmetered work
 * @param maxInstances ceiling of concurrent invocations sharing {@code jobKey}
 * @param timeout      upper bound for the invocation, {@code null} for none
 */
public record ExecutionLimits(String jobKey, int maxInstances, Duration timeout) {

    public ExecutionLimits {
        if (jobKey != null && maxInstances < 1) {
            throw new IllegalArgumentException("maxInstances must be at least 1 but was " + maxInstances);
        }
    }

    public static ExecutionLimits unmetered() {
        return new ExecutionLimits(null, 0, null);
    }

    public static ExecutionLimits of(String jobKey, int maxInstances) {
        return new ExecutionLimits(jobKey, maxInstances, null);
    }

    public ExecutionLimits withTimeout(Duration timeout) {
        return new ExecutionLimits(jobKey, maxInstances, timeout);
    }
}
