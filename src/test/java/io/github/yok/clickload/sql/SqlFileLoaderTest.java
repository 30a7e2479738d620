package io.github.yok.clickload.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.clickload.util.RecordingDiagnostics;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlFileLoaderTest {

    @Test
    void load_正常ケース_テンプレートファイル_変数が展開されること(@TempDir File tmpDir) throws Exception {
        File sql = new File(tmpDir, "create_table.sql");
        FileUtils.writeStringToFile(sql, "CREATE TABLE {{DB}}.t (id UInt64)",
                StandardCharsets.UTF_8);
        SqlFileLoader loader = new SqlFileLoader(
                new SqlTemplateRenderer(Map.of("DB", "raw"), new RecordingDiagnostics()));

        assertEquals("CREATE TABLE raw.t (id UInt64)", loader.load(sql.getPath()));
    }

    @Test
    void load_異常ケース_存在しないファイル_NoSuchFileExceptionが送出されること(@TempDir File tmpDir) {
        SqlFileLoader loader =
                new SqlFileLoader(new SqlTemplateRenderer(Map.of(), new RecordingDiagnostics()));
        String missing = new File(tmpDir, "missing.sql").getPath();

        NoSuchFileException ex =
                assertThrows(NoSuchFileException.class, () -> loader.load(missing));
        assertEquals(missing, ex.getFile());
    }

    @Test
    void exists_正常ケース_ファイルとディレクトリ_ファイルのみtrueとなること(@TempDir File tmpDir)
            throws Exception {
        File sql = new File(tmpDir, "a.sql");
        FileUtils.writeStringToFile(sql, "SELECT 1", StandardCharsets.UTF_8);

        assertTrue(SqlFileLoader.exists(sql.getPath()));
        assertFalse(SqlFileLoader.exists(tmpDir.getPath()));
        assertFalse(SqlFileLoader.exists(null));
    }
}
