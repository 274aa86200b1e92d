package com.schedq.trigger;

import com.schedq.InvalidJobDefinitionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires on a cron schedule.
 * <p>
 * Accepts the five-field form {@code minute hour day month day-of-week}, where the
 * second is taken to be {@code 0}, and the six-field form with a leading seconds field.
 * Evaluation happens in the trigger's timezone, so daylight saving transitions follow
 * the local wall clock.
 */
public final class CronTrigger implements Trigger {

    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;
    private final boolean explicitZone;
    private final DateBound start;
    private final DateBound end;
    private final Instant startDate;
    private final Instant endDate;

    CronTrigger(String expression, ZoneId zone, boolean explicitZone, DateBound start, DateBound end) {
        this.expression = normalize(expression);
        this.cron = parse(this.expression);
        this.zone = Objects.requireNonNull(zone, "zone");
        this.explicitZone = explicitZone;
        this.start = start;
        this.end = end;
        this.startDate = DateBound.resolve(start, zone);
        this.endDate = DateBound.resolve(end, zone);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidJobDefinitionException(
                    "Cron trigger start date " + startDate + " is after its end date " + endDate);
        }
    }

    private static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidJobDefinitionException("Cron expression must not be blank");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length == 5) {
            return "0 " + String.join(" ", parts);
        }
        if (parts.length == 6) {
            return String.join(" ", parts);
        }
        throw new InvalidJobDefinitionException(
                "Invalid cron expression: " + expression + ". Expected 5 or 6 parts.");
    }

    private static CronExpression parse(String expression) {
        try {
            return CronExpression.parse(expression.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidJobDefinitionException(
                    "Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        Instant reference = after;
        if (startDate != null && reference.isBefore(startDate)) {
            reference = startDate.minusNanos(1);
        }
        ZonedDateTime next = cron.next(reference.atZone(zone));
        if (next == null) {
            return Optional.empty();
        }
        Instant fireTime = next.toInstant();
        if (endDate != null && fireTime.isAfter(endDate)) {
            return Optional.empty();
        }
        return Optional.of(fireTime);
    }

    @Override
    public Trigger withDefaultZone(ZoneId defaultZone) {
        if (explicitZone || defaultZone.equals(zone)) {
            return this;
        }
        return new CronTrigger(expression, defaultZone, false, start, end);
    }

    /**
     * The six-field expression this trigger evaluates.
     */
    public String getExpression() {
        return expression;
    }

    public ZoneId getZone() {
        return zone;
    }

    public Optional<Instant> getStartDate() {
        return Optional.ofNullable(startDate);
    }

    public Optional<Instant> getEndDate() {
        return Optional.ofNullable(endDate);
    }

    @Override
    public String toString() {
        return "cron[" + expression + ", " + zone + "]";
    }

    /**
     * Keyword form of a cron trigger. Fields that are not set match every value,
     * except the second which defaults to {@code 0}.
     */
    public static final class Fields {

        private String second = "0";
        private String minute = "*";
        private String hour = "*";
        private String day = "*";
        private String month = "*";
        private String dayOfWeek = "*";
        private String timezone;
        private String startDate;
        private String endDate;

        Fields() {
        }

        public Fields second(String second) {
            this.second = field("second", second);
            return this;
        }

        public Fields second(int second) {
            return second(String.valueOf(second));
        }

        public Fields minute(String minute) {
            this.minute = field("minute", minute);
            return this;
        }

        public Fields minute(int minute) {
            return minute(String.valueOf(minute));
        }

        public Fields hour(String hour) {
            this.hour = field("hour", hour);
            return this;
        }

        public Fields hour(int hour) {
            return hour(String.valueOf(hour));
        }

        public Fields day(String day) {
            this.day = field("day", day);
            return this;
        }

        public Fields day(int day) {
            return day(String.valueOf(day));
        }

        public Fields month(String month) {
            this.month = field("month", month);
            return this;
        }

        public Fields month(int month) {
            return month(String.valueOf(month));
        }

        public Fields dayOfWeek(String dayOfWeek) {
            this.dayOfWeek = field("day of week", dayOfWeek);
            return this;
        }

        public Fields timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Fields startDate(String startDate) {
            this.startDate = startDate;
            return this;
        }

        public Fields endDate(String endDate) {
            this.endDate = endDate;
            return this;
        }

        public CronTrigger build() {
            String expression = String.join(" ", second, minute, hour, day, month, dayOfWeek);
            return Triggers.cron(expression, timezone, startDate, endDate);
        }

        private static String field(String name, String value) {
            if (value == null || value.isBlank() || value.trim().contains(" ")) {
                throw new InvalidJobDefinitionException("Invalid cron " + name + " field '" + value + "'");
            }
            return value.trim();
        }
    }
}
