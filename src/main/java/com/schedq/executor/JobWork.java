package com.schedq.executor;

import com.schedq.AsyncScheduledJob;
import com.schedq.JobContext;
import com.schedq.ScheduledJob;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * A unit of work started on a worker thread. Blocking work completes before
 * {@link #start()} returns; asynchronous work returns a stage that completes later.
 */
@FunctionalInterface
public interface JobWork {

    CompletionStage<?> start() throws Exception;

    static JobWork blocking(Callable<?> task) {
        return () -> CompletableFuture.completedFuture(task.call());
    }

    static JobWork async(Supplier<? extends CompletionStage<?>> task) {
        return task::get;
    }

    static JobWork of(ScheduledJob job, JobContext context) {
        if (job instanceof AsyncScheduledJob asyncJob) {
            return async(() -> asyncJob.executeAsync(context));
        }
        return blocking(() -> job.execute(context));
    }
}
