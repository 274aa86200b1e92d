package com.schedq.trigger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Computes the fire times of a job.
 * <p>
 * Implementations are immutable and safe to share between threads.
 */
public interface Trigger {

    /**
     * Returns the first fire time strictly after {@code after}, or empty when the
     * trigger will never fire again.
     */
    Optional<Instant> nextFireTime(Instant after);

    /**
     * Returns a copy of this trigger that evaluates in {@code zone} unless a zone was
     * set explicitly when the trigger was declared.
     */
    default Trigger withDefaultZone(ZoneId zone) {
        return this;
    }
}
