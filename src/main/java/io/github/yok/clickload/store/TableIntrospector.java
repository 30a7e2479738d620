package io.github.yok.clickload.store;

import io.github.yok.clickload.core.DestinationSchema;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only questions asked of the destination table, plus the compaction statement.
 *
 * @author Yasuharu.Okawauchi
 */
public class TableIntrospector {

    private final TableStore store;

    public TableIntrospector(TableStore store) {
        this.store = store;
    }

    /**
     * Reads the destination schema with {@code DESCRIBE TABLE}.
     *
     * @param table table name
     * @return schema in table order
     * @throws SQLException if the table does not exist or the store is unreachable
     */
    public DestinationSchema describe(String table) throws SQLException {
        return DestinationSchema.fromDescribeRows(store.query("DESCRIBE TABLE " + table));
    }

    /**
     * Counts the rows of a table.
     *
     * @param table table name
     * @return row count
     * @throws SQLException on failure
     */
    public long countRows(String table) throws SQLException {
        List<List<Object>> rows = store.query("SELECT count() FROM " + table);
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return 0L;
        }
        return toLong(rows.get(0).get(0));
    }

    /**
     * Returns the greatest value of a column, typically the most recently loaded date.
     *
     * @param table table name
     * @param column column name
     * @return value as text; empty when the table has no rows
     * @throws SQLException on failure
     */
    public Optional<String> maxValue(String table, String column) throws SQLException {
        List<List<Object>> rows =
                store.query("SELECT max(" + JdbcTableStore.quoteIdentifier(column) + ") FROM "
                        + table + " HAVING count() > 0");
        if (rows.isEmpty() || rows.get(0).isEmpty() || rows.get(0).get(0) == null) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(rows.get(0).get(0)));
    }

    /**
     * @param table table name
     * @return default compaction statement for the table
     */
    public static String defaultCompaction(String table) {
        return "OPTIMIZE TABLE " + table + " FINAL";
    }

    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(String.valueOf(value).trim());
    }
}
