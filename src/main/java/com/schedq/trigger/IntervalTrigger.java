package com.schedq.trigger;

import com.schedq.InvalidJobDefinitionException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Fires every fixed period.
 * <p>
 * With a start date the fire times lie on the grid {@code start + k * period}; without
 * one, each fire time is one period after the reference time. Start and end dates given
 * without an offset are read in the trigger's timezone, which falls back to the
 * scheduler's timezone when none was declared.
 */
public final class IntervalTrigger implements Trigger {

    private final Duration period;
    private final DateBound start;
    private final DateBound end;
    private final ZoneId zone;
    private final boolean explicitZone;
    private final Instant startDate;
    private final Instant endDate;

    IntervalTrigger(Duration period, DateBound start, DateBound end, ZoneId zone, boolean explicitZone) {
        Instant startDate = DateBound.resolve(start, zone);
        Instant endDate = DateBound.resolve(end, zone);
        if (period == null || period.isZero() || period.isNegative()) {
            throw new InvalidJobDefinitionException("Interval must be positive but was " + period);
        }
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidJobDefinitionException(
                    "Interval trigger start date " + startDate + " is after its end date " + endDate);
        }
        this.period = period;
        this.start = start;
        this.end = end;
        this.zone = zone;
        this.explicitZone = explicitZone;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        Instant next;
        if (startDate == null) {
            next = after.plus(period);
        } else if (after.isBefore(startDate)) {
            next = startDate;
        } else {
            long elapsedPeriods = Duration.between(startDate, after).dividedBy(period);
            next = startDate.plus(period.multipliedBy(elapsedPeriods + 1));
        }
        if (endDate != null && next.isAfter(endDate)) {
            return Optional.empty();
        }
        return Optional.of(next);
    }

    @Override
    public Trigger withDefaultZone(ZoneId defaultZone) {
        if (explicitZone || defaultZone.equals(zone)) {
            return this;
        }
        return new IntervalTrigger(period, start, end, defaultZone, false);
    }

    public Duration getPeriod() {
        return period;
    }

    public Optional<Instant> getStartDate() {
        return Optional.ofNullable(startDate);
    }

    public Optional<Instant> getEndDate() {
        return Optional.ofNullable(endDate);
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return "interval[" + period + "]";
    }

    public static final class Builder {

        private Duration period = Duration.ZERO;
        private String startDate;
        private String endDate;
        private Instant startInstant;
        private Instant endInstant;
        private String timezone;

        Builder() {
        }

        public Builder weeks(long weeks) {
            period = period.plusDays(weeks * 7);
            return this;
        }

        public Builder days(long days) {
            period = period.plusDays(days);
            return this;
        }

        public Builder hours(long hours) {
            period = period.plusHours(hours);
            return this;
        }

        public Builder minutes(long minutes) {
            period = period.plusMinutes(minutes);
            return this;
        }

        public Builder seconds(long seconds) {
            period = period.plusSeconds(seconds);
            return this;
        }

        public Builder period(Duration period) {
            this.period = this.period.plus(period);
            return this;
        }

        public Builder startDate(String startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startInstant = startDate;
            return this;
        }

        public Builder endDate(String endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endInstant = endDate;
            return this;
        }

        /**
         * Timezone used to read start and end dates that carry no offset.
         */
        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public IntervalTrigger build() {
            boolean explicitZone = timezone != null;
            ZoneId zone = explicitZone ? DateTimes.zone(timezone) : Triggers.DEFAULT_ZONE;
            DateBound start = startInstant != null ? DateBound.of(startInstant) : DateBound.parse(startDate);
            DateBound end = endInstant != null ? DateBound.of(endInstant) : DateBound.parse(endDate);
            return new IntervalTrigger(period, start, end, zone, explicitZone);
        }
    }
}
