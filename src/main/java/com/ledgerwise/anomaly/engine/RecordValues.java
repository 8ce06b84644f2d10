package com.ledgerwise.anomaly.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Lenient readers for loosely typed record values.
 */
public final class RecordValues {

    private RecordValues() {}

    /**
     * Parse a timestamp into epoch millis. Accepts epoch-millis numbers (or numeric strings),
     * ISO-8601 instants and offset date-times, ISO local date-times and dates (read as UTC),
     * {@link Date} and {@link Instant}.
     *
     * @return epoch millis, or null when the value is missing or unparseable
     */
    public static Long parseTimestamp(Object value) {
        if (value == null) return null;
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? number.longValue() : null;
        }
        if (value instanceof Date date) return date.getTime();
        if (value instanceof Instant instant) return instant.toEpochMilli();
        if (value instanceof OffsetDateTime odt) return odt.toInstant().toEpochMilli();
        if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC).toEpochMilli();
        if (value instanceof LocalDate ld) return ld.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

        String text = value.toString().trim();
        if (text.isEmpty()) return null;
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant().toEpochMilli();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Read a finite numeric value from a number or numeric string.
     *
     * @return the value, or null when it is missing, non-numeric, NaN or infinite
     */
    public static Double parseNumber(Object value) {
        if (value == null) return null;
        double d;
        if (value instanceof Number number) {
            d = number.doubleValue();
        } else {
            String text = value.toString().trim();
            if (text.isEmpty()) return null;
            try {
                d = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(d) ? d : null;
    }
}
