package com.schedq;

/**
 * The work a job performs, together with its optional callbacks.
 * <p>
 * {@link #execute(JobContext)} runs on a worker thread, never on the scheduling thread.
 * Callbacks run after the attempt they describe; an exception thrown from a callback is
 * logged and does not change the outcome of the run.
 */
@FunctionalInterface
public interface ScheduledJob {

    /**
     * Performs one attempt. Any exception marks the attempt as failed and is handed to
     * the job's retry strategy.
     *
     * @return a result passed to {@link #onSuccess(JobContext, Object)}, may be {@code null}
     */
    Object execute(JobContext context) throws Exception;

    default void onSuccess(JobContext context, Object result) {
        // no-op
    }

    /**
     * Called for every failed attempt, the final one included.
     */
    default void onError(JobContext context, Throwable error) {
        // no-op
    }

    /**
     * Called when a retry of the failed attempt described by {@code context} has been scheduled.
     */
    default void onRetry(JobContext context, Throwable error) {
        // no-op
    }
}
