package com.schedq.internal;

import com.schedq.config.SchedQProperties;
import com.schedq.history.ExecutionHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public class HistoryCleaner {

    private static final Logger log = LoggerFactory.getLogger(HistoryCleaner.class);

    private final ExecutionHistory history;
    private final SchedQProperties properties;
    private final Clock clock;

    public HistoryCleaner(ExecutionHistory history, SchedQProperties properties, Clock clock) {
        this.history = history;
        this.properties = properties;
        this.clock = clock;
    }

    // Run cleaner every hour
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        int retentionDays = properties.getHistory().getRetentionDays();
        if (retentionDays <= 0) {
            return;
        }
        try {
            Instant threshold = clock.instant().minus(Duration.ofDays(retentionDays));
            int deleted = history.deleteFinishedBefore(threshold);
            if (deleted > 0) {
                log.info("Cleaned up {} execution record(s) older than {} days", deleted, retentionDays);
            }
        } catch (RuntimeException e) {
            log.error("Failed to clean up execution history", e);
        }
    }
}
