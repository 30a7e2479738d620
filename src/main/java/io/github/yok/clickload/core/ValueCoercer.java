package io.github.yok.clickload.core;

import io.github.yok.clickload.util.Diagnostics;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts raw string cells into values of the destination column's {@link SemanticType}.
 *
 * <p>
 * Empty or missing input always yields {@link NoValue}, whatever the type. A value that cannot be
 * converted also yields {@link NoValue} and a warning on the diagnostics sink; conversion never
 * throws, so one malformed cell never fails a run.
 * </p>
 *
 * <ul>
 * <li>INTEGER / UNSIGNED_INTEGER: base-10, surrounding whitespace ignored. Values that fit in 64
 * bits become {@link Long}, larger ones {@link BigInteger}. Negative unsigned values are
 * rejected.</li>
 * <li>FLOAT: {@link Double}; {@code nan} and {@code inf} spellings are accepted.</li>
 * <li>DATE / DATE_TIME: {@link FlexibleDateTimeParsers}; DATE keeps the date part only.</li>
 * <li>TEXT: passed through unchanged.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class ValueCoercer {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?|nan|inf|infinity)",
            Pattern.CASE_INSENSITIVE);

    private final Diagnostics diagnostics;

    public ValueCoercer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Coerces one raw cell.
     *
     * @param raw raw value; {@code null} means the cell was missing from a short row
     * @param type destination type
     * @return typed value or {@link NoValue#INSTANCE}
     */
    public Object coerce(String raw, SemanticType type) {
        if (raw == null || raw.isEmpty()) {
            return NoValue.INSTANCE;
        }
        switch (type) {
            case INTEGER:
                return toInteger(raw, false);
            case UNSIGNED_INTEGER:
                return toInteger(raw, true);
            case FLOAT:
                return toFloat(raw);
            case DATE:
                return toDateTime(raw, type).map(v -> (Object) v.toLocalDate())
                        .orElse(NoValue.INSTANCE);
            case DATE_TIME:
                return toDateTime(raw, type).map(v -> (Object) v).orElse(NoValue.INSTANCE);
            case TEXT:
            default:
                return raw;
        }
    }

    /**
     * Coerces a raw row into a row aligned with the mapping's destination order.
     *
     * <p>
     * Cells are picked by source index. An index beyond the end of a short (ragged) row is treated
     * as a missing cell; cells beyond the header are ignored.
     * </p>
     *
     * @param rawRow raw cells
     * @param mapping column mapping
     * @return coerced row, one cell per mapping entry
     */
    public List<Object> coerceRow(List<String> rawRow, ColumnMapping mapping) {
        List<Object> row = new ArrayList<>(mapping.size());
        for (ColumnMapping.Entry entry : mapping.getEntries()) {
            int idx = entry.getSourceIndex();
            String raw = idx < rawRow.size() ? rawRow.get(idx) : null;
            row.add(coerce(raw, entry.getType()));
        }
        return row;
    }

    private Object toInteger(String raw, boolean unsigned) {
        String text = raw.strip();
        if (!INTEGER.matcher(text).matches()) {
            diagnostics.warn("Could not convert '{}' to {}", raw,
                    unsigned ? SemanticType.UNSIGNED_INTEGER : SemanticType.INTEGER);
            return NoValue.INSTANCE;
        }
        BigInteger value = new BigInteger(text);
        if (unsigned && value.signum() < 0) {
            diagnostics.warn("Negative value '{}' for {} column", raw,
                    SemanticType.UNSIGNED_INTEGER);
            return NoValue.INSTANCE;
        }
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }

    private Object toFloat(String raw) {
        String text = raw.strip();
        if (!FLOAT.matcher(text).matches()) {
            diagnostics.warn("Could not convert '{}' to {}", raw, SemanticType.FLOAT);
            return NoValue.INSTANCE;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith("nan")) {
            return Double.NaN;
        }
        if (lower.endsWith("inf") || lower.endsWith("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(text);
    }

    private Optional<LocalDateTime> toDateTime(String raw, SemanticType type) {
        Optional<LocalDateTime> parsed = FlexibleDateTimeParsers.parse(raw);
        if (parsed.isEmpty()) {
            diagnostics.warn("Could not parse '{}' as {}", raw, type);
        }
        return parsed;
    }
}
