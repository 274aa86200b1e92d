package com.schedq.trigger;

import com.schedq.InvalidJobDefinitionException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Factory methods for the built-in triggers.
 *
 * <pre>{@code
 * Triggers.cron("0 8 * * *");
 * Triggers.cron().hour(8).minute(0).dayOfWeek("MON-FRI").build();
 * Triggers.interval().minutes(30).build();
 * Triggers.once("2026-12-31 23:59:59");
 * }</pre>
 */
public final class Triggers {

    /**
     * Zone used by triggers that declare none, until the scheduler applies its own.
     */
    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Shanghai");

    private Triggers() {
    }

    public static CronTrigger cron(String expression) {
        return cron(expression, null, null, null);
    }

    public static CronTrigger cron(String expression, String timezone) {
        return cron(expression, timezone, null, null);
    }

    public static CronTrigger cron(String expression, String timezone, String startDate, String endDate) {
        boolean explicitZone = timezone != null;
        ZoneId zone = explicitZone ? DateTimes.zone(timezone) : DEFAULT_ZONE;
        return new CronTrigger(expression, zone, explicitZone, DateBound.parse(startDate), DateBound.parse(endDate));
    }

    public static CronTrigger.Fields cron() {
        return new CronTrigger.Fields();
    }

    public static IntervalTrigger.Builder interval() {
        return new IntervalTrigger.Builder();
    }

    public static IntervalTrigger interval(Duration period) {
        return new IntervalTrigger(period, null, null, DEFAULT_ZONE, false);
    }

    public static DateTrigger once(Instant runDate) {
        if (runDate == null) {
            throw new InvalidJobDefinitionException("run_date is required for once trigger");
        }
        return new DateTrigger(runDate);
    }

    public static DateTrigger once(String runDate) {
        return once(runDate, null);
    }

    public static DateTrigger once(String runDate, String timezone) {
        if (runDate == null || runDate.isBlank()) {
            throw new InvalidJobDefinitionException("run_date is required for once trigger");
        }
        Instant absolute = DateTimes.parseAbsolute(runDate);
        if (absolute != null) {
            return new DateTrigger(absolute);
        }
        boolean explicitZone = timezone != null;
        ZoneId zone = explicitZone ? DateTimes.zone(timezone) : DEFAULT_ZONE;
        return new DateTrigger(DateTimes.parseLocal(runDate), zone, explicitZone);
    }
}
