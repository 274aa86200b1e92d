package com.schedq.trigger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * A start or end date as declared: an instant, or a wall-clock time read in the zone of
 * the trigger that carries it.
 */
record DateBound(Instant absolute, LocalDateTime local) {

    static DateBound of(Instant instant) {
        return instant == null ? null : new DateBound(instant, null);
    }

    static DateBound parse(String text) {
        if (text == null) {
            return null;
        }
        Instant absolute = DateTimes.parseAbsolute(text);
        return absolute != null ? new DateBound(absolute, null) : new DateBound(null, DateTimes.parseLocal(text));
    }

    static Instant resolve(DateBound bound, ZoneId zone) {
        if (bound == null) {
            return null;
        }
        return bound.absolute != null ? bound.absolute : bound.local.atZone(zone).toInstant();
    }
}
