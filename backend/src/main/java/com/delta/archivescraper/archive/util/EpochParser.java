package com.delta.archivescraper.archive.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Turns user supplied time bounds into epoch seconds.
 * Accepts plain epoch seconds, ISO-8601 instants or offset date-times, zoned date-times
 * ({@code 2024-01-01T00:00+09:00[Asia/Seoul]}), and zone-less local dates or date-times which
 * are read in the caller's zone.
 */
public final class EpochParser {

    private EpochParser() {}

    public static Long parse(String raw) {
        return parse(raw, ZoneOffset.UTC);
    }

    public static Long parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        try {
            return OffsetDateTime.parse(value).toEpochSecond();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return ZonedDateTime.parse(value).toEpochSecond();
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less forms
        }
        try {
            return LocalDateTime.parse(value).atZone(zone).toEpochSecond();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(value).atStartOfDay(zone).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Value must be an epoch timestamp or ISO-8601 date-time: " + raw, e);
        }
    }
}
