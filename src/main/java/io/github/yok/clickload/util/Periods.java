package io.github.yok.clickload.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import lombok.Generated;

/**
 * Helpers for {@code YYYY-MM-DD} period tokens used in source path patterns.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Periods {

    /**
     * Strict {@code uuuu-MM-dd} formatter; rejects dates such as {@code 2024-02-30}.
     */
    public static final DateTimeFormatter PERIOD_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    // Separator between the two ends of a period range, e.g. 2024-01-01..2024-01-31
    public static final String RANGE_SEPARATOR = "..";

    @Generated
    private Periods() {}

    /**
     * Checks whether the value is a valid {@code YYYY-MM-DD} date.
     *
     * @param value candidate value
     * @return {@code true} if the value parses strictly
     */
    public static boolean isValidDate(String value) {
        return parseOrNull(value) != null;
    }

    /**
     * Parses a {@code YYYY-MM-DD} date.
     *
     * @param value candidate value
     * @return parsed date, or {@code null} if the value is null or not a valid date
     */
    public static LocalDate parseOrNull(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value, PERIOD_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Checks whether the period is a {@code START..END} range.
     *
     * @param period period value
     * @return {@code true} if the value contains the range separator
     */
    public static boolean isRange(String period) {
        return period != null && period.contains(RANGE_SEPARATOR);
    }

    /**
     * Expands an inclusive {@code START..END} range into one token per day, ascending.
     *
     * @param period range value
     * @return day tokens; empty when {@code END} is before {@code START}
     * @throws IllegalArgumentException if either end is not a valid {@code YYYY-MM-DD} date
     */
    public static List<String> range(String period) {
        int idx = period.indexOf(RANGE_SEPARATOR);
        String startText = period.substring(0, idx).trim();
        String endText = period.substring(idx + RANGE_SEPARATOR.length()).trim();
        LocalDate start = parseOrNull(startText);
        LocalDate end = parseOrNull(endText);
        if (start == null || end == null) {
            throw new IllegalArgumentException("Invalid period range: " + period);
        }
        List<String> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            days.add(d.format(PERIOD_FORMAT));
        }
        return days;
    }
}
