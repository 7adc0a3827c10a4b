package com.lynkvertx.evfeas.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient coercion of raw table cells into timestamps and numbers.
 *
 * Both parsers return empty instead of throwing: a cell that cannot be coerced marks its row
 * as invalid and the row is dropped by the normalizers.
 */
public final class CellParsing {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        isoLike(),
        formatter("uuuu/M/d H:mm[:ss]"),
        formatter("M/d/uuuu H:mm[:ss]"),
        formatter("M/d/uuuu h:mm[:ss] a"),
        formatter("M/d/uu H:mm[:ss]"),
        formatter("d.M.uuuu H:mm[:ss]"),
        formatter("d-MMM-uuuu H:mm[:ss]"),
        formatter("d MMM uuuu H:mm[:ss]"),
        formatter("MMM d, uuuu H:mm[:ss]"),
        formatter("MMM d, uuuu h:mm[:ss] a")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        formatter("uuuu-M-d"),
        formatter("uuuu/M/d"),
        formatter("M/d/uuuu"),
        formatter("M/d/uu"),
        formatter("d.M.uuuu"),
        formatter("d-MMM-uuuu"),
        formatter("d MMM uuuu"),
        formatter("MMM d, uuuu")
    );

    private CellParsing() {
    }

    /**
     * Parse a combined date-time, or a bare date (midnight).
     * Hour 24 and other out-of-range fields are rejected.
     */
    public static Optional<LocalDateTime> parseTimestamp(String raw) {
        String value = normalizeWhitespace(raw);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return parseDate(value).map(LocalDate::atStartOfDay);
    }

    /** Parse "date time" built from two separate cells. */
    public static Optional<LocalDateTime> parseTimestamp(String date, String time) {
        return parseTimestamp(nullToEmpty(date).trim() + " " + nullToEmpty(time).trim());
    }

    public static Optional<LocalDate> parseDate(String raw) {
        String value = normalizeWhitespace(raw);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        return Optional.empty();
    }

    /**
     * Strict numeric coercion. Blank cells, text, NaN and infinities are rejected;
     * thousands separators are not interpreted.
     */
    public static Optional<BigDecimal> parseDecimal(String raw) {
        String value = nullToEmpty(raw).trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static boolean containsIgnoreCase(String value, String token) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(token.toLowerCase(Locale.ROOT));
    }

    /**
     * ISO-style date-time with a space or 'T' separator, any fraction up to nanoseconds and an
     * optional offset. The offset is dropped: readings keep the meter's wall-clock time.
     */
    private static DateTimeFormatter isoLike() {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("uuuu-M-d['T'][ ]H:mm[:ss]")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.US)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static String normalizeWhitespace(String raw) {
        return nullToEmpty(raw).trim().replaceAll("\\s+", " ");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
