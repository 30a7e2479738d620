package io.github.yok.clickload.store;

import io.github.yok.clickload.core.NoValue;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableStore} over a single JDBC {@link Connection}.
 *
 * <p>
 * Bulk inserts use one {@link PreparedStatement} with batched rows. Identifiers are quoted with
 * backticks. {@link NoValue} cells are bound as SQL {@code NULL}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcTableStore implements TableStore {

    private final Connection connection;

    public JdbcTableStore(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void execute(String statement) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(statement);
        }
    }

    @Override
    public List<List<Object>> query(String statement) throws SQLException {
        List<List<Object>> rows = new ArrayList<>();
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery(statement)) {
            int columnCount = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    @Override
    public void bulkInsert(String table, List<String> columns, List<List<Object>> rows)
            throws SQLException {
        String sql = insertSql(table, columns);
        log.debug("Bulk insert SQL: {}", sql);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (List<Object> row : rows) {
                for (int i = 0; i < columns.size(); i++) {
                    Object value = i < row.size() ? row.get(i) : NoValue.INSTANCE;
                    bind(ps, i + 1, value);
                }
                ps.addBatch();
            }
            int[] counts = ps.executeBatch();
            log.debug("Table[{}] batch of {} rows sent, driver reported {}", table, rows.size(),
                    Arrays.stream(counts).filter(c -> c > 0).sum());
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    /**
     * Builds the parameterized insert statement.
     *
     * @param table destination table (may be {@code db.table})
     * @param columns column names
     * @return {@code INSERT INTO table (`a`, `b`) VALUES (?, ?)}
     */
    static String insertSql(String table, List<String> columns) {
        String cols = columns.stream().map(JdbcTableStore::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String params = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + cols + ") VALUES (" + params + ")";
    }

    static String quoteIdentifier(String name) {
        return "`" + name.replace("`", "``") + "`";
    }

    private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (NoValue.is(value) || value == null) {
            ps.setObject(index, null);
        } else if (value instanceof BigInteger) {
            ps.setObject(index, ((BigInteger) value).toString());
        } else {
            ps.setObject(index, value);
        }
    }
}
