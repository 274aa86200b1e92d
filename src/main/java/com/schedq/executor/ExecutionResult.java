package com.schedq.executor;

/**
 * Outcome of an invocation that did not fail. A rejected invocation never ran because
 * its job key was at its concurrency ceiling.
 */
public record ExecutionResult(boolean rejected, Object value, String jobKey, int runningInstances) {

    public static ExecutionResult completed(String jobKey, Object value) {
        return new ExecutionResult(false, value, jobKey, 0);
    }

    public static ExecutionResult rejected(String jobKey, int runningInstances) {
        return new ExecutionResult(true, null, jobKey, runningInstances);
    }
}
