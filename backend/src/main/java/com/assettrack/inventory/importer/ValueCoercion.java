package com.assettrack.inventory.importer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/** Lenient text-to-value conversions used by the record builders. None of them throw. */
public final class ValueCoercion {

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/uuuu");

    private ValueCoercion() {}

    /**
     * Accepts {@code 2024-03-01}, {@code 3/1/2024} and ISO date-times with or without an
     * offset. Offset date-times are normalized to UTC. Returns {@code null} when unparseable.
     */
    public static LocalDateTime parseDateTime(String text) {
        if (text == null || text.isBlank()) return null;
        String t = text.trim();
        try {
            if (t.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(t, OffsetDateTime::from, LocalDateTime::from);
                if (parsed instanceof OffsetDateTime) {
                    return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
                }
                return (LocalDateTime) parsed;
            }
            if (t.indexOf('/') > 0) return LocalDate.parse(t, US_DATE).atStartOfDay();
            return LocalDate.parse(t).atStartOfDay();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    public static Coerced<LocalDate> toDate(String text) {
        if (text == null) return Coerced.missing();
        LocalDateTime parsed = parseDateTime(text);
        return new Coerced<>(text, parsed == null ? null : parsed.toLocalDate());
    }

    public static Coerced<LocalDateTime> toDateTime(String text) {
        if (text == null) return Coerced.missing();
        return new Coerced<>(text, parseDateTime(text));
    }

    /** Integer value of {@code text}; 0 when empty or not a number. */
    public static long toLongOrZero(String text) {
        if (text == null || text.isBlank()) return 0L;
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
