package io.github.yok.clickload.core;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative column layout of the destination table: an ordered, immutable mapping from the
 * canonical (case-sensitive) column name to its {@link SemanticType}.
 *
 * <p>
 * Read once per run from the store and shared read-only by the reconciler and the coercer.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DestinationSchema {

    private final ImmutableMap<String, SemanticType> columns;

    private DestinationSchema(ImmutableMap<String, SemanticType> columns) {
        this.columns = columns;
    }

    /**
     * Creates a schema from an ordered map.
     *
     * @param columns column name to type, in table order
     * @return schema
     */
    public static DestinationSchema of(Map<String, SemanticType> columns) {
        return new DestinationSchema(ImmutableMap.copyOf(columns));
    }

    /**
     * Creates a schema from {@code DESCRIBE TABLE} rows (name, store type, ...).
     *
     * @param describeRows result rows; only the first two cells are read
     * @return schema
     */
    public static DestinationSchema fromDescribeRows(List<List<Object>> describeRows) {
        ImmutableMap.Builder<String, SemanticType> builder = ImmutableMap.builder();
        for (List<Object> row : describeRows) {
            String name = String.valueOf(row.get(0));
            String type = row.size() > 1 && row.get(1) != null ? String.valueOf(row.get(1)) : null;
            builder.put(name, SemanticType.fromStoreType(type));
        }
        return new DestinationSchema(builder.buildKeepingLast());
    }

    /**
     * @return column names in table order
     */
    public List<String> columnNames() {
        return columns.keySet().asList();
    }

    /**
     * @param column canonical column name
     * @return its type, if the column exists
     */
    public Optional<SemanticType> typeOf(String column) {
        return Optional.ofNullable(columns.get(column));
    }

    /**
     * @param column candidate name (case-sensitive)
     * @return {@code true} if the table has exactly this column
     */
    public boolean contains(String column) {
        return columns.containsKey(column);
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public int size() {
        return columns.size();
    }

    /**
     * @return unmodifiable view of the ordered mapping
     */
    public Map<String, SemanticType> asMap() {
        return columns;
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
