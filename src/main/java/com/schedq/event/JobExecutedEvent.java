package com.schedq.event;

import com.schedq.JobContext;

import java.time.Duration;
import java.time.Instant;

public record JobExecutedEvent(JobContext context, Instant endTime, Duration duration, Object result) {
}
