package com.schedq.event;

import java.time.Instant;

public record JobMissedEvent(String jobCode, String jobName, Instant scheduledTime, Instant detectedAt) {
}
