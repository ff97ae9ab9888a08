package com.last9.mcpserver.utility;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Utility class for the timestamp formats exchanged with callers and the telemetry backend.
 * All instants are handled in UTC.
 */
@UtilityClass
public class TimestampFormatUtility {

    public static final String ACCEPTED_FORMATS =
            "'YYYY-MM-DD HH:MM:SS' (UTC) or RFC3339 (e.g. 2024-06-01T10:00:00Z, 2024-06-01T10:00:00.123Z, 2024-06-01T15:30:00+05:30)";

    private static final DateTimeFormatter SIMPLE_UTC =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter RFC3339_SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    /**
     * Parse a caller supplied timestamp.
     *
     * @param value "YYYY-MM-DD HH:MM:SS" (interpreted as UTC) or RFC3339 with optional
     *              fractional seconds and offset
     * @return the instant
     * @throws IllegalArgumentException naming the accepted formats if the value matches neither
     */
    public static Instant parseInstant(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Timestamp cannot be empty. Expected " + ACCEPTED_FORMATS);
        }
        String trimmed = value.trim();
        try {
            if (trimmed.indexOf('T') < 0) {
                return LocalDateTime.parse(trimmed, SIMPLE_UTC).toInstant(ZoneOffset.UTC);
            }
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid timestamp '%s'. Expected %s", value, ACCEPTED_FORMATS), e);
        }
    }

    /**
     * Format a nanosecond epoch string as RFC3339 (second precision, UTC).
     * Values that are not integers are returned unchanged.
     */
    public static String formatEpochNanos(String nanos) {
        if (nanos == null) {
            return "";
        }
        try {
            long value = Long.parseLong(nanos.trim());
            return formatEpochNanos(value);
        } catch (NumberFormatException e) {
            return nanos;
        }
    }

    public static String formatEpochNanos(long nanos) {
        Instant instant = Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
        return RFC3339_SECONDS.format(instant);
    }

    /**
     * Normalize a backend RFC3339 timestamp (nanosecond precision first, then plain RFC3339)
     * to UTC. Unparseable values are returned unchanged.
     */
    public static String normalizeRfc3339(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        try {
            return DateTimeFormatter.ISO_INSTANT.format(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeParseException e) {
            try {
                return DateTimeFormatter.ISO_INSTANT.format(OffsetDateTime.parse(value, DateTimeFormatter.ISO_DATE_TIME));
            } catch (DateTimeParseException ignored) {
                return value;
            }
        }
    }
}
