package com.schedq;

/**
 * Lifecycle state of one run. Everything except {@link #RUNNING} and
 * {@link #FAILED_RETRY_PENDING} is terminal for the occurrence.
 */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED_RETRY_PENDING,
    FAILED_FINAL,
    SKIPPED_LOCK,
    SKIPPED_CONCURRENCY,
    MISSED;

    public boolean isSkipped() {
        return this == SKIPPED_LOCK || this == SKIPPED_CONCURRENCY;
    }

    public boolean isTerminal() {
        return this != RUNNING && this != FAILED_RETRY_PENDING;
    }
}
