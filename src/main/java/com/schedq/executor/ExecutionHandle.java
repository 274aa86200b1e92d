package com.schedq.executor;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted invocation.
 *
 * @param result   outcome of the invocation; fails with a {@link java.util.concurrent.TimeoutException}
 *                 as soon as the timeout elapses
 * @param finished completes once the work has actually stopped running, which for work that
 *                 ignores interruption may be well after {@code result} timed out
 */
public record ExecutionHandle(CompletableFuture<ExecutionResult> result, CompletableFuture<Void> finished) {

    static ExecutionHandle done(CompletableFuture<ExecutionResult> result) {
        return new ExecutionHandle(result, CompletableFuture.completedFuture(null));
    }
}
