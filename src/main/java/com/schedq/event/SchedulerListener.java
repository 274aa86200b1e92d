package com.schedq.event;

/**
 * Receives scheduler events. Methods are called on scheduler or worker threads and
 * should return quickly; exceptions are logged and ignored.
 */
public interface SchedulerListener {

    default void onJobExecuted(JobExecutedEvent event) {
    }

    default void onJobError(JobErrorEvent event) {
    }

    default void onJobRetry(JobRetryEvent event) {
    }

    default void onJobMissed(JobMissedEvent event) {
    }

    default void onJobSkipped(JobSkippedEvent event) {
    }
}
