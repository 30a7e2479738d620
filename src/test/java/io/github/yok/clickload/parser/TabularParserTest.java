package io.github.yok.clickload.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.clickload.util.RecordingDiagnostics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TabularParserTest {

    private RecordingDiagnostics diagnostics;
    private TabularParser parser;

    @BeforeEach
    void setup() {
        diagnostics = new RecordingDiagnostics();
        parser = new TabularParser(diagnostics);
    }

    @Test
    void parse_正常ケース_引用符と改行を含むCSV_ヘッダと行が分離されること() throws Exception {
        RawTable table = parser.parse(bytes("id,note\n1,\"a,b\"\n2,\"line1\nline2\"\n"));

        assertEquals(List.of("id", "note"), table.getHeader());
        assertEquals(List.of(List.of("1", "a,b"), List.of("2", "line1\nline2")), table.getRows());
        assertFalse(table.isTruncated());
        assertTrue(diagnostics.hasInfo("Parsed 2 rows with 2 columns"));
    }

    @Test
    void parse_正常ケース_列数が不揃いの行_そのまま保持されること() throws Exception {
        RawTable table = parser.parse(bytes("a,b,c\n1\n1,2,3,4\n"));

        assertEquals(List.of("1"), table.getRows().get(0));
        assertEquals(4, table.getRows().get(1).size());
    }

    @Test
    void parse_正常ケース_空行を含む_全項目空の行として保持されること() throws Exception {
        RawTable table = parser.parse(bytes("a,b\n,,\n1\n\n3,4,5\n"), DataFormat.CSV, 10);

        assertEquals(List.of(List.of("", "", ""), List.of("1"), List.of(""),
                List.of("3", "4", "5")), table.getRows());
        assertTrue(diagnostics.hasInfo("Parsed 4 rows with 2 columns"));
    }

    @Test
    void parse_正常ケース_TSV形式_タブで分割されること() throws Exception {
        RawTable table = parser.parse(bytes("id\tname\n1\tx y\n"), DataFormat.TSV, 10);

        assertEquals(List.of("id", "name"), table.getHeader());
        assertEquals(List.of("1", "x y"), table.getRows().get(0));
    }

    @Test
    void parse_正常ケース_上限を超える行数_上限件数で打ち切られ警告されること() throws Exception {
        RawTable table = parser.parse(bytes("id\n1\n2\n3\n4\n"), DataFormat.CSV, 3);

        assertEquals(3, table.rowCount());
        assertTrue(table.isTruncated());
        assertEquals(List.of("Reached maximum row limit of 3. Data truncated."),
                diagnostics.getWarnings());
    }

    @Test
    void parse_正常ケース_上限ちょうどの行数_打ち切られないこと() throws Exception {
        RawTable table = parser.parse(bytes("id\n1\n2\n3\n"), DataFormat.CSV, 3);

        assertEquals(3, table.rowCount());
        assertFalse(table.isTruncated());
        assertTrue(diagnostics.getWarnings().isEmpty());
    }

    @Test
    void parse_正常ケース_空の内容_ヘッダなしとなること() throws Exception {
        RawTable table = parser.parse(new byte[0]);

        assertFalse(table.hasHeader());
        assertEquals(0, table.rowCount());
    }

    @Test
    void parse_異常ケース_閉じていない引用符_IOExceptionが送出されること() {
        assertThrows(IOException.class, () -> parser.parse(bytes("id,note\n1,\"open\n")));
    }

    @Test
    void parse_異常ケース_区切り文字形式でない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(bytes("x"), DataFormat.PARQUET, 10));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse(bytes("x"), DataFormat.CSV, 0));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
