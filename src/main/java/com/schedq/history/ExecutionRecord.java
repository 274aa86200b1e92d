package com.schedq.history;

import com.schedq.JobContext;
import com.schedq.RunStatus;
import com.schedq.TriggerType;

import java.time.Duration;
import java.time.Instant;

/**
 * One attempt as seen by the history. Runs of sub-jobs are filed under the parent
 * code, with {@code jobCode} naming the sub-job that ran.
 */
public record ExecutionRecord(
        String runId,
        String ownerCode,
        String jobCode,
        String jobName,
        int attempt,
        TriggerType triggerType,
        String retryOf,
        Instant scheduledTime,
        Instant startTime,
        Instant endTime,
        RunStatus status,
        String result,
        String errorMessage,
        String errorType) {

    static ExecutionRecord started(String ownerCode, JobContext context) {
        return new ExecutionRecord(context.runId(), ownerCode, context.jobCode(), context.jobName(),
                context.attempt(), context.triggerType(), context.retryOf(), context.scheduledTime(),
                context.startTime(), null, RunStatus.RUNNING, null, null, null);
    }

    ExecutionRecord finish(Instant endTime, RunStatus status, String result, Throwable error) {
        return new ExecutionRecord(runId, ownerCode, jobCode, jobName, attempt, triggerType, retryOf,
                scheduledTime, startTime, endTime, status, result,
                error == null ? null : error.getMessage(),
                error == null ? null : error.getClass().getName());
    }

    public Duration duration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }
}
