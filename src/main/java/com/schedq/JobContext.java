package com.schedq;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one execution attempt of a job. A new context is created for every attempt,
 * retries included, and is never shared between concurrent runs.
 *
 * @param jobId          stable id of the registered job
 * @param jobCode        code of the job, {@code CODE#n} for a sub-job
 * @param jobName        display name
 * @param jobDescription description, possibly empty
 * @param runId          id of this attempt, assigned when the run is created
 * @param attempt        1 for the first attempt, incremented on every retry
 * @param triggerType    what caused this attempt
 * @param scheduledTime  the fire time this attempt was created for
 * @param startTime      when execution began, {@code null} until then
 * @param retryOf        run id of the failed attempt, only for {@link TriggerType#RETRY}
 * @param runCount       executions of this job before this one
 * @param extra          caller-supplied values
 */
public record JobContext(
        String jobId,
        String jobCode,
        String jobName,
        String jobDescription,
        String runId,
        int attempt,
        TriggerType triggerType,
        Instant scheduledTime,
        Instant startTime,
        String retryOf,
        long runCount,
        Map<String, Object> extra) {

    public JobContext {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(jobCode, "jobCode");
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(triggerType, "triggerType");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1 but was " + attempt);
        }
        if (retryOf != null && triggerType != TriggerType.RETRY) {
            throw new IllegalArgumentException("retryOf is only valid for retry attempts");
        }
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public JobContext withStartTime(Instant startTime) {
        return new JobContext(jobId, jobCode, jobName, jobDescription, runId, attempt, triggerType,
                scheduledTime, startTime, retryOf, runCount, extra);
    }

    /**
     * Returns the context of the attempt that retries this one. The scheduled time of the
     * original occurrence is kept.
     */
    public JobContext nextAttempt(String nextRunId, long nextRunCount) {
        return new JobContext(jobId, jobCode, jobName, jobDescription, nextRunId, attempt + 1, TriggerType.RETRY,
                scheduledTime, null, runId, nextRunCount, extra);
    }
}
