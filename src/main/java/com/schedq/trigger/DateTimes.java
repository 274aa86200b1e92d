package com.schedq.trigger;

import com.schedq.InvalidJobDefinitionException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;

/**
 * Parses the date-time strings accepted by trigger declarations:
 * {@code 2026-12-31 23:59:59}, {@code 2026-12-31T23:59:59}, an ISO offset form such as
 * {@code 2026-12-31T23:59:59+08:00}, or a plain date.
 */
final class DateTimes {

    private static final DateTimeFormatter LOCAL = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private DateTimes() {
    }

    /**
     * Returns the absolute instant if the text carries an offset, otherwise {@code null}.
     */
    static Instant parseAbsolute(String text) {
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException notOffset) {
            return null;
        }
    }

    static LocalDateTime parseLocal(String text) {
        String trimmed = text.trim();
        try {
            return LocalDateTime.parse(trimmed, LOCAL);
        } catch (DateTimeParseException notDateTime) {
            try {
                return LocalDate.parse(trimmed).atStartOfDay();
            } catch (DateTimeParseException e) {
                throw new InvalidJobDefinitionException("Invalid date-time '" + text + "'", e);
            }
        }
    }

    static ZoneId zone(String zoneId) {
        try {
            return ZoneId.of(zoneId);
        } catch (RuntimeException e) {
            throw new InvalidJobDefinitionException("Unknown timezone '" + zoneId + "'", e);
        }
    }
}
