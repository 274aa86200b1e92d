package com.schedq.event;

import com.schedq.JobContext;
import com.schedq.RunStatus;

/**
 * An occurrence that did not run because the lock was held elsewhere or the job was at
 * its concurrency ceiling.
 */
public record JobSkippedEvent(JobContext context, RunStatus reason) {
}
