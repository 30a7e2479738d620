package io.github.yok.clickload.core;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import lombok.Generated;

/**
 * Ordered date/time formats tried when a cell is coerced to {@link SemanticType#DATE} or
 * {@link SemanticType#DATE_TIME}.
 *
 * <p>
 * The first format that parses wins. A trailing {@code Z} is stripped and the value is taken as a
 * local date-time. Day-first formats are tried before month-first ones, so {@code 03/04/2024} is
 * read as 3 April. This order is relied upon and must not be changed.
 * </p>
 *
 * <ol>
 * <li>{@code yyyy-MM-ddTHH:mm:ssZ}, {@code yyyy-MM-ddTHH:mm:ss.SSSSSSZ}</li>
 * <li>{@code yyyy-MM-dd HH:mm:ss}, {@code yyyy-MM-dd HH:mm:ss.SSSSSS}</li>
 * <li>{@code yyyy-MM-ddTHH:mm:ss}, {@code yyyy-MM-ddTHH:mm:ss.SSSSSS}</li>
 * <li>{@code yyyy-MM-dd}</li>
 * <li>{@code dd/MM/yyyy HH:mm:ss}, {@code dd/MM/yyyy}</li>
 * <li>{@code MM/dd/yyyy HH:mm:ss}, {@code MM/dd/yyyy}</li>
 * </ol>
 *
 * <p>
 * Numeric fields accept one or two digits and fractions accept one to six digits. Resolution is
 * strict: {@code 2024-02-30} does not parse.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexibleDateTimeParsers {

    // Formats tried for values ending in Z, after the marker is removed
    static final List<DateTimeFormatter> UTC_MARKER_FORMATS =
            ImmutableList.of(dateTime("uuuu-M-d'T'H:m:s", false),
                    dateTime("uuuu-M-d'T'H:m:s", true));

    // General formats, in priority order
    static final List<DateTimeFormatter> FORMATS = ImmutableList.of(
            dateTime("uuuu-M-d H:m:s", false), dateTime("uuuu-M-d H:m:s", true),
            dateTime("uuuu-M-d'T'H:m:s", false), dateTime("uuuu-M-d'T'H:m:s", true),
            date("uuuu-M-d"), dateTime("d/M/uuuu H:m:s", false), date("d/M/uuuu"),
            dateTime("M/d/uuuu H:m:s", false), date("M/d/uuuu"));

    @Generated
    private FlexibleDateTimeParsers() {}

    /**
     * Parses a date/time value with the ordered format list.
     *
     * @param value raw cell value
     * @return parsed local date-time (midnight for date-only formats), or empty if no format
     *         matched
     */
    public static Optional<LocalDateTime> parse(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        if (value.endsWith("Z")) {
            String naive = value.substring(0, value.length() - 1);
            for (DateTimeFormatter f : UTC_MARKER_FORMATS) {
                Optional<LocalDateTime> parsed = tryParse(naive, f);
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        for (DateTimeFormatter f : FORMATS) {
            Optional<LocalDateTime> parsed = tryParse(value, f);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> tryParse(String value, DateTimeFormatter formatter) {
        try {
            TemporalAccessor parsed = formatter.parse(value);
            if (parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
                return Optional.of(LocalDateTime.from(parsed));
            }
            return Optional.of(LocalDate.from(parsed).atStartOfDay());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter dateTime(String pattern, boolean fraction) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().appendPattern(pattern);
        if (fraction) {
            builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true);
        }
        return builder.toFormatter().withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter date(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
