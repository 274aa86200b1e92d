package com.schedq;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a registered job. For a multi-trigger parent the counters add up
 * its sub-jobs and {@code nextRunTime} is the earliest of theirs.
 */
public record JobSnapshot(
        String code,
        String jobId,
        String name,
        String description,
        String parentCode,
        List<String> subJobCodes,
        int triggerCount,
        String trigger,
        Instant nextRunTime,
        boolean paused,
        long totalRuns,
        long successRuns,
        long failedRuns,
        String lastRunId,
        Instant lastRunTime,
        RunStatus lastStatus,
        int runningInstances) {

    public boolean multiTrigger() {
        return triggerCount > 1;
    }

    /**
     * Percentage of successful runs, rounded to two decimals.
     */
    public double successRate() {
        return SchedulerStats.rate(successRuns, totalRuns);
    }
}
