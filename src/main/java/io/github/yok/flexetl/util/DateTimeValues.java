package io.github.yok.flexetl.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import lombok.Generated;

/**
 * Date/time helpers shared by the transform pipeline, the payload codec and the sink loader.
 *
 * <p>
 * Parsing is permissive: ISO date-times with an offset or zone are tried first (the offset is
 * dropped, the local wall time kept), then ISO dates, then day-first dates ({@code dd/MM/yyyy},
 * {@code dd-MM-yyyy}, {@code dd.MM.yyyy}), each with an optional {@code HH:mm[:ss[.fraction]]}
 * time part. Resolution is strict: an impossible date such as {@code 31/02/2024} matches
 * nothing. A value that matches none of them yields {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DateTimeValues {

    /**
     * Canonical date-time text form ({@code yyyy-MM-dd HH:mm:ss}).
     */
    public static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Parsers tried in order by {@link #parseDayFirst(Object)}.
     */
    private static final List<DateTimeFormatter> PARSERS = List.of(withOptionalTime("uuuu-MM-dd"),
            withOptionalTime("uuuu/MM/dd"), withOptionalTime("d/M/uuuu"),
            withOptionalTime("d-M-uuuu"), withOptionalTime("d.M.uuuu"));

    // 2024-01-05T10:00:00Z, 2024-01-05 10:00:00+02:00, 2024-01-05T10:00+01:00[Europe/Paris]
    private static final DateTimeFormatter ZONED_PARSER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart()
            .appendLiteral('T').optionalEnd().optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME).appendOffsetId().optionalStart()
            .appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']')
            .optionalEnd().toFormatter().withResolverStyle(ResolverStyle.STRICT);

    @Generated
    private DateTimeValues() {}

    /**
     * Returns whether the value carries both a date and a time of day.
     *
     * @param value any value
     * @return {@code true} for {@link LocalDateTime}, {@link OffsetDateTime},
     *         {@link ZonedDateTime} and {@link Instant}
     */
    public static boolean isDateTime(Object value) {
        return value instanceof LocalDateTime || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof Instant;
    }

    /**
     * Formats a date-time value with {@link #CANONICAL}. Offsets and zones are dropped; an
     * {@link Instant} is rendered in UTC.
     *
     * @param value date-time value (see {@link #isDateTime(Object)})
     * @return canonical text
     * @throws IllegalArgumentException if the value is not a date-time
     */
    public static String formatCanonical(Object value) {
        return toLocalDateTime(value).format(CANONICAL);
    }

    /**
     * Renders any temporal value as text: date-times in canonical form, dates and times in ISO
     * form.
     *
     * @param value temporal value
     * @return text form, or {@code null} if the value is not temporal
     */
    public static String toText(Object value) {
        if (isDateTime(value)) {
            return formatCanonical(value);
        }
        if (value instanceof LocalDate || value instanceof LocalTime) {
            return value.toString();
        }
        return null;
    }

    /**
     * Returns whether the value is any of the temporal types handled here.
     *
     * @param value any value
     * @return {@code true} when {@link #toText(Object)} can render it
     */
    public static boolean isTemporal(Object value) {
        return isDateTime(value) || value instanceof LocalDate || value instanceof LocalTime;
    }

    /**
     * Converts a value to a {@link LocalDateTime}, resolving ambiguous textual dates day-first.
     *
     * @param value value to convert
     * @return the date-time, or {@code null} when the value cannot be interpreted as one
     */
    public static LocalDateTime parseDayFirst(Object value) {
        if (isDateTime(value)) {
            return toLocalDateTime(value);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (!(value instanceof String)) {
            return null;
        }
        String text = ((String) value).trim();
        LocalDateTime zoned = tryParseZoned(text);
        if (zoned != null) {
            return zoned;
        }
        for (DateTimeFormatter parser : PARSERS) {
            LocalDateTime parsed = tryParse(text, parser);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static LocalDateTime tryParse(String text, DateTimeFormatter parser) {
        try {
            return LocalDateTime.parse(text, parser);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime tryParseZoned(String text) {
        try {
            return ZonedDateTime.parse(text, ZONED_PARSER).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("Not a date-time value: " + value);
    }

    private static DateTimeFormatter withOptionalTime(String datePattern) {
        return new DateTimeFormatterBuilder().appendPattern(datePattern).optionalStart()
                .optionalStart().appendLiteral(' ').optionalEnd().optionalStart()
                .appendLiteral('T').optionalEnd().appendPattern("HH:mm").optionalStart()
                .appendPattern(":ss").optionalEnd().optionalStart()
                .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd().parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0).toFormatter()
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
