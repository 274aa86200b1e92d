package com.schedq;

import java.util.concurrent.CompletionStage;

/**
 * A job whose work completes asynchronously. The attempt ends when the returned stage
 * completes; the worker thread that started it is released immediately.
 */
public interface AsyncScheduledJob extends ScheduledJob {

    CompletionStage<?> executeAsync(JobContext context);

    @Override
    default Object execute(JobContext context) throws Exception {
        return executeAsync(context).toCompletableFuture().get();
    }
}
