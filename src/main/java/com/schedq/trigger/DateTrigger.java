package com.schedq.trigger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Fires exactly once.
 * <p>
 * A run date given without an offset is read in the trigger's timezone, which falls
 * back to the scheduler's timezone when none was declared.
 */
public final class DateTrigger implements Trigger {

    private final Instant absoluteRunDate;
    private final LocalDateTime localRunDate;
    private final ZoneId zone;
    private final boolean explicitZone;

    DateTrigger(Instant absoluteRunDate) {
        this.absoluteRunDate = absoluteRunDate;
        this.localRunDate = null;
        this.zone = null;
        this.explicitZone = false;
    }

    DateTrigger(LocalDateTime localRunDate, ZoneId zone, boolean explicitZone) {
        this.absoluteRunDate = null;
        this.localRunDate = localRunDate;
        this.zone = zone;
        this.explicitZone = explicitZone;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        Instant runDate = getRunDate();
        return runDate.isAfter(after) ? Optional.of(runDate) : Optional.empty();
    }

    @Override
    public Trigger withDefaultZone(ZoneId defaultZone) {
        if (absoluteRunDate != null || explicitZone || defaultZone.equals(zone)) {
            return this;
        }
        return new DateTrigger(localRunDate, defaultZone, false);
    }

    public Instant getRunDate() {
        return absoluteRunDate != null ? absoluteRunDate : localRunDate.atZone(zone).toInstant();
    }

    @Override
    public String toString() {
        return "date[" + (absoluteRunDate != null ? absoluteRunDate : localRunDate + " " + zone) + "]";
    }
}
