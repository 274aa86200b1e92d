package com.schedq.event;

import com.schedq.JobContext;

import java.time.Duration;
import java.time.Instant;

/**
 * @param failedContext context of the attempt that failed
 * @param nextAttempt   number of the scheduled attempt
 * @param delay         wait before the scheduled attempt
 * @param nextRetryTime when the scheduled attempt becomes due
 */
public record JobRetryEvent(JobContext failedContext, int nextAttempt, Duration delay, Instant nextRetryTime,
                            Throwable error) {
}
