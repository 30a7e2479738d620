package io.github.yok.clickload.store;

import java.sql.SQLException;
import java.util.List;

/**
 * Already-connected handle on the destination table store.
 *
 * @author Yasuharu.Okawauchi
 * @see JdbcTableStore
 */
public interface TableStore extends AutoCloseable {

    /**
     * Executes a statement that returns no rows (DDL, {@code INSERT ... SELECT}, {@code OPTIMIZE}).
     *
     * @param statement SQL statement
     * @throws SQLException on syntax or constraint violation, or when the store is unreachable
     */
    void execute(String statement) throws SQLException;

    /**
     * Runs a query and materializes its result. Only used for schema introspection and aggregates,
     * so results are small.
     *
     * @param statement SQL query
     * @return rows, each a list of column values in select order
     * @throws SQLException on failure
     */
    List<List<Object>> query(String statement) throws SQLException;

    /**
     * Appends rows to a table in one bulk operation.
     *
     * @param table destination table
     * @param columns destination column names, aligned with each row
     * @param rows coerced rows; {@link io.github.yok.clickload.core.NoValue} cells are sent as null
     * @throws SQLException if the insert is rejected
     */
    void bulkInsert(String table, List<String> columns, List<List<Object>> rows)
            throws SQLException;

    @Override
    void close() throws SQLException;
}
