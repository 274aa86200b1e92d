package com.schedq.history;

import com.schedq.JobContext;
import com.schedq.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Record of past attempts, keyed by run id.
 */
public interface ExecutionHistory {

    void recordStart(String ownerCode, JobContext context);

    void recordSuccess(String ownerCode, JobContext context, Instant endTime, Object result);

    void recordFailure(String ownerCode, JobContext context, Instant endTime, Throwable error, boolean willRetry);

    /**
     * Records a run that never executed: skipped for lock or concurrency, or missed.
     */
    void recordSkip(String ownerCode, JobContext context, RunStatus reason);

    Optional<ExecutionRecord> find(String runId);

    /**
     * Most recent records first.
     */
    List<ExecutionRecord> findByJob(String ownerCode, int limit);

    /**
     * Removes finished records that ended before {@code threshold}.
     *
     * @return number of removed records
     */
    int deleteFinishedBefore(Instant threshold);
}
