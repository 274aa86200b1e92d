package com.schedq.store;

import com.schedq.RunStatus;

import java.time.Instant;

/**
 * Scheduling state of one job code that survives a restart.
 */
public record JobState(
        String code,
        String jobId,
        Instant nextFireTime,
        boolean paused,
        long runCount,
        long successCount,
        long failCount,
        String lastRunId,
        Instant lastRunTime,
        RunStatus lastStatus) {
}
