package com.schedq;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a dispatched run. {@code completion} yields the final status of the run's
 * whole attempt chain, retries included.
 */
public record JobRun(String runId, String jobCode, CompletableFuture<RunStatus> completion) {
}
