package io.github.yok.clickload.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.clickload.core.NoValue;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcTableStoreTest {

    private Connection connection;
    private JdbcTableStore store;

    @BeforeEach
    void setup() {
        connection = mock(Connection.class);
        store = new JdbcTableStore(connection);
    }

    @Test
    void insertSql_正常ケース_列名_バッククォートで囲まれること() {
        assertEquals("INSERT INTO db.t (`id`, `my``col`) VALUES (?, ?)",
                JdbcTableStore.insertSql("db.t", List.of("id", "my`col")));
    }

    @Test
    void bulkInsert_正常ケース_NoValueとBigInteger_NULLと文字列でバインドされること()
            throws Exception {
        PreparedStatement ps = mock(PreparedStatement.class);
        when(connection.prepareStatement("INSERT INTO t (`a`, `b`, `c`) VALUES (?, ?, ?)"))
                .thenReturn(ps);
        when(ps.executeBatch()).thenReturn(new int[] {1, 1});
        LocalDate date = LocalDate.of(2024, 1, 1);

        store.bulkInsert("t", List.of("a", "b", "c"),
                List.of(Arrays.asList(1L, NoValue.INSTANCE, date),
                        Arrays.asList(new BigInteger("18446744073709551615"), "x", null)));

        verify(ps).setObject(1, 1L);
        verify(ps).setObject(2, null);
        verify(ps).setObject(3, date);
        verify(ps).setObject(1, "18446744073709551615");
        verify(ps).setObject(2, "x");
        verify(ps).setObject(3, null);
        verify(ps, times(2)).addBatch();
        verify(ps).executeBatch();
        verify(ps).close();
    }

    @Test
    void query_正常ケース_結果セット_行と列のリストに変換されること() throws Exception {
        Statement st = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(connection.createStatement()).thenReturn(st);
        when(st.executeQuery("DESCRIBE TABLE t")).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getObject(1)).thenReturn("id", "name");
        when(rs.getObject(2)).thenReturn("UInt64", "String");

        List<List<Object>> rows = store.query("DESCRIBE TABLE t");

        assertEquals(List.of(List.of("id", "UInt64"), List.of("name", "String")), rows);
        verify(rs).close();
        verify(st).close();
    }

    @Test
    void execute_異常ケース_ドライバが失敗する_SQLExceptionが伝播しStatementが閉じられること()
            throws Exception {
        Statement st = mock(Statement.class);
        when(connection.createStatement()).thenReturn(st);
        doThrow(new SQLException("Code: 60. Table does not exist")).when(st).execute(anyString());

        assertThrows(SQLException.class, () -> store.execute("OPTIMIZE TABLE t FINAL"));

        verify(st).close();
    }

    @Test
    void close_正常ケース_接続が閉じられること() throws Exception {
        store.close();

        verify(connection).close();
    }
}
