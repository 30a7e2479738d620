package io.github.yok.clickload.core;

import java.util.Locale;

/**
 * Semantic type tag of a destination column. Drives per-cell coercion.
 *
 * <ul>
 * <li>INTEGER: signed base-10 integer</li>
 * <li>UNSIGNED_INTEGER: non-negative base-10 integer</li>
 * <li>FLOAT: floating point</li>
 * <li>DATE: calendar date (time of day discarded)</li>
 * <li>DATE_TIME: local date-time</li>
 * <li>TEXT: passed through unchanged</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SemanticType {
    // Int8 .. Int256
    INTEGER,
    // UInt8 .. UInt256
    UNSIGNED_INTEGER,
    // Float32, Float64
    FLOAT,
    // Date, Date32
    DATE,
    // DateTime, DateTime64(n)
    DATE_TIME,
    // String, FixedString, Decimal, UUID, Enum, ...
    TEXT;

    /**
     * Maps a store type name as reported by {@code DESCRIBE TABLE} to a semantic type.
     *
     * <p>
     * {@code Nullable(...)} and {@code LowCardinality(...)} wrappers are removed first. The prefix
     * checks are ordered so that {@code DateTime} is tested before {@code Date} and {@code UInt}
     * before {@code Int}.
     * </p>
     *
     * @param storeType type name, e.g. {@code Nullable(DateTime64(3))}
     * @return semantic type; {@link #TEXT} for anything not recognised
     */
    public static SemanticType fromStoreType(String storeType) {
        if (storeType == null) {
            return TEXT;
        }
        String t = unwrap(storeType.trim());
        if (t.startsWith("DateTime")) {
            return DATE_TIME;
        }
        if (t.startsWith("Date")) {
            return DATE;
        }
        if (t.startsWith("UInt")) {
            return UNSIGNED_INTEGER;
        }
        if (t.startsWith("Int")) {
            return INTEGER;
        }
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.startsWith("float") || lower.startsWith("double")) {
            return FLOAT;
        }
        return TEXT;
    }

    private static String unwrap(String type) {
        String t = type;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String wrapper : new String[] {"Nullable(", "LowCardinality("}) {
                if (t.startsWith(wrapper) && t.endsWith(")")) {
                    t = t.substring(wrapper.length(), t.length() - 1).trim();
                    changed = true;
                }
            }
        }
        return t;
    }
}
