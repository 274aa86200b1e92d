package com.schedq.event;

import com.schedq.JobContext;

import java.time.Duration;
import java.time.Instant;

/**
 * A failed attempt. {@code willRetry} tells whether another attempt has been scheduled.
 */
public record JobErrorEvent(JobContext context, Instant endTime, Duration duration, Throwable error,
                            boolean willRetry) {
}
