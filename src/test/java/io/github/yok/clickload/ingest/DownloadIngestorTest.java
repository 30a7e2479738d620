package io.github.yok.clickload.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.clickload.core.FailureKind;
import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.parser.DataFormat;
import io.github.yok.clickload.source.RemoteFileMetadata;
import io.github.yok.clickload.source.RemoteFileSource;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DownloadIngestorTest {

    @TempDir
    File tmpDir;

    private RemoteFileSource fileSource;
    private String createSql;

    @BeforeEach
    void setup() throws Exception {
        fileSource = mock(RemoteFileSource.class);
        createSql = SqlFixtures.write(tmpDir, "create.sql", "CREATE TABLE sheet (id UInt64)");
    }

    @Test
    void validate_異常ケース_ファイルID未指定_CONFIGURATIONとなること() {
        DownloadIngestor ingestor = new DownloadIngestor(null, "sheet", createSql, null,
                fileSource, SqlFixtures.loader(Map.of()));

        assertEquals(FailureKind.CONFIGURATION,
                ingestor.validate(new IngestionOptions()).getFailure().getKind());
    }

    @Test
    void validate_異常ケース_最適化ファイルが存在しない_CONFIGURATIONとなること() {
        DownloadIngestor ingestor = new DownloadIngestor("f1", "sheet", createSql,
                new File(tmpDir, "optimize.sql").getPath(), fileSource,
                SqlFixtures.loader(Map.of()));

        assertTrue(ingestor.validate(new IngestionOptions()).getFailure().getMessage()
                .startsWith("SQL file not found"));
    }

    @Test
    void resolveSources_正常ケース_ファイルID一件のマニフェストとなること() {
        DownloadIngestor ingestor = new DownloadIngestor("f1", "sheet", createSql, null,
                fileSource, SqlFixtures.loader(Map.of()));

        assertEquals(List.of("f1"), ingestor.resolveSources().getValue().getLocators());
    }

    @Test
    void fetch_正常ケース_TSVファイル名_TSVとして読み込まれること() throws Exception {
        when(fileSource.getMetadata("f1"))
                .thenReturn(new RemoteFileMetadata("f1", "export.TSV", "text/plain"));
        when(fileSource.download("f1")).thenReturn("id\tname\n".getBytes(StandardCharsets.UTF_8));
        DownloadIngestor ingestor = new DownloadIngestor("f1", "sheet", createSql, null,
                fileSource, SqlFixtures.loader(Map.of()));

        SourcePayload.TabularContent payload = (SourcePayload.TabularContent) ingestor.fetch("f1");

        assertEquals(DataFormat.TSV, payload.getFormat());
    }

    @Test
    void fetch_正常ケース_拡張子なしのファイル名_CSVとして読み込まれること() throws Exception {
        when(fileSource.getMetadata("f1"))
                .thenReturn(new RemoteFileMetadata("f1", "unknown_file", null));
        when(fileSource.download("f1")).thenReturn(new byte[0]);
        DownloadIngestor ingestor = new DownloadIngestor("f1", "sheet", createSql, null,
                fileSource, SqlFixtures.loader(Map.of()));

        SourcePayload.TabularContent payload = (SourcePayload.TabularContent) ingestor.fetch("f1");

        assertEquals(DataFormat.CSV, payload.getFormat());
    }

    @Test
    void fetch_異常ケース_ダウンロード失敗_IOExceptionが伝播すること() throws Exception {
        when(fileSource.getMetadata("f1"))
                .thenReturn(new RemoteFileMetadata("f1", "a.csv", "text/csv"));
        when(fileSource.download("f1")).thenThrow(new IOException("403 Forbidden"));
        DownloadIngestor ingestor = new DownloadIngestor("f1", "sheet", createSql, null,
                fileSource, SqlFixtures.loader(Map.of()));

        assertThrows(IOException.class, () -> ingestor.fetch("f1"));
    }
}
