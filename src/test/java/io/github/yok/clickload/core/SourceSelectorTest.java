package io.github.yok.clickload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.clickload.config.SourceStrategy;
import io.github.yok.clickload.source.InMemoryObjectStore;
import io.github.yok.clickload.util.RecordingDiagnostics;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SourceSelectorTest {

    private InMemoryObjectStore store;
    private RecordingDiagnostics diagnostics;
    private SourceSelector selector;

    @BeforeEach
    void setup() {
        store = new InMemoryObjectStore("b");
        diagnostics = new RecordingDiagnostics();
        selector = new SourceSelector(store, "{{DATE}}", diagnostics);
    }

    @Test
    void select_正常ケース_LATEST指定_最新日付のファイルが選ばれること() throws Exception {
        store.put("exports/2024-01-01.csv", "a").put("exports/2024-03-15.csv", "b")
                .put("exports/2024-02-10.csv", "c").put("exports/notes.txt", "x");

        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.csv", SourceStrategy.LATEST, null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("s3://b/exports/2024-03-15.csv"), result.getValue().getLocators());
        assertEquals(List.of("exports/"), store.getListedPrefixes());
    }

    @Test
    void select_正常ケース_LATEST指定でParquetと日付なしが混在_最新日付のキーが選ばれること()
            throws Exception {
        store.put("data/2024-01-05.parquet", "").put("data/2024-02-10.parquet", "")
                .put("data/not-a-date.parquet", "");

        Outcome<SourceManifest> result =
                selector.select("data/{{DATE}}.parquet", SourceStrategy.LATEST, null);

        assertEquals(List.of("s3://b/data/2024-02-10.parquet"), result.getValue().getLocators());
    }

    @Test
    void select_正常ケース_LATEST指定を繰り返す_一覧不変なら同じキーで新しい日付追加で切り替わること()
            throws Exception {
        store.put("data/2024-01-05.parquet", "").put("data/2024-02-10.parquet", "");

        SourceManifest first =
                selector.select("data/{{DATE}}.parquet", SourceStrategy.LATEST, null).getValue();
        SourceManifest second =
                selector.select("data/{{DATE}}.parquet", SourceStrategy.LATEST, null).getValue();
        assertEquals(first, second);

        // より新しい日付のファイルを追加する
        store.put("data/2024-03-01.parquet", "");
        SourceManifest third =
                selector.select("data/{{DATE}}.parquet", SourceStrategy.LATEST, null).getValue();

        assertEquals(List.of("s3://b/data/2024-02-10.parquet"), second.getLocators());
        assertEquals(List.of("s3://b/data/2024-03-01.parquet"), third.getLocators());
    }

    @Test
    void select_正常ケース_LATEST指定で日付なしファイルを含む_警告され日付ありが選ばれること()
            throws Exception {
        store.put("exports/latest.csv", "a").put("exports/2024-01-01.csv", "b");

        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.csv", SourceStrategy.LATEST, null);

        assertEquals(List.of("s3://b/exports/2024-01-01.csv"), result.getValue().getLocators());
        assertEquals(1, diagnostics.warningsContaining("exports/latest.csv").size());
    }

    @Test
    void select_異常ケース_LATEST指定で日付付きファイルがない_SOURCE_RESOLUTIONとなること()
            throws Exception {
        store.put("exports/a.csv", "a").put("exports/b.csv", "b");

        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.csv", SourceStrategy.LATEST, null);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.SOURCE_RESOLUTION, result.getFailure().getKind());
    }

    @Test
    void select_異常ケース_一覧が空_SOURCE_RESOLUTIONとなること() throws Exception {
        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.csv", SourceStrategy.LATEST, null);

        assertEquals(FailureKind.SOURCE_RESOLUTION, result.getFailure().getKind());
    }

    @Test
    void select_異常ケース_拡張子が一致しない_SOURCE_RESOLUTIONとなること() throws Exception {
        store.put("exports/2024-01-01.parquet", "a");

        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.csv", SourceStrategy.ALL, null);

        assertEquals(FailureKind.SOURCE_RESOLUTION, result.getFailure().getKind());
    }

    @Test
    void select_正常ケース_ALL指定_一覧順で拡張子一致の全件となること() throws Exception {
        store.put("d/x.CSV", "1").put("d/y.txt", "2").put("d/z.csv", "3");

        Outcome<SourceManifest> result = selector.select("d/*.csv", SourceStrategy.ALL, null);

        assertEquals(List.of("s3://b/d/x.CSV", "s3://b/d/z.csv"), result.getValue().getLocators());
    }

    @Test
    void select_正常ケース_PERIOD範囲指定_日毎のロケータが昇順で返ること() throws Exception {
        Outcome<SourceManifest> result = selector.select("exports/{{DATE}}.parquet",
                SourceStrategy.PERIOD, "2024-01-30..2024-02-02");

        assertEquals(List.of("s3://b/exports/2024-01-30.parquet",
                "s3://b/exports/2024-01-31.parquet", "s3://b/exports/2024-02-01.parquet",
                "s3://b/exports/2024-02-02.parquet"),
                result.getValue().getLocators());
        // 期間指定では一覧取得しない
        assertTrue(store.getListedPrefixes().isEmpty());
    }

    @Test
    void select_正常ケース_PERIOD単日で不正な日付_警告され文字列がそのまま置換されること()
            throws Exception {
        Outcome<SourceManifest> result =
                selector.select("exports/{{DATE}}.parquet", SourceStrategy.PERIOD, "latest-run");

        assertEquals(List.of("s3://b/exports/latest-run.parquet"),
                result.getValue().getLocators());
        assertEquals(1, diagnostics.warningsContaining("latest-run").size());
    }

    @Test
    void select_異常ケース_PERIOD範囲が逆順_SOURCE_RESOLUTIONとなること() throws Exception {
        Outcome<SourceManifest> result = selector.select("exports/{{DATE}}.parquet",
                SourceStrategy.PERIOD, "2024-02-02..2024-01-30");

        assertEquals(FailureKind.SOURCE_RESOLUTION, result.getFailure().getKind());
    }

    @Test
    void validate_異常ケース_PERIODで期間なし_CONFIGURATIONとなること() {
        Outcome<Void> result = selector.validate(SourceStrategy.PERIOD, " ");

        assertEquals(FailureKind.CONFIGURATION, result.getFailure().getKind());
        assertTrue(store.getListedPrefixes().isEmpty());
    }

    @Test
    void validate_異常ケース_不正な範囲と未知の戦略_CONFIGURATIONとなること() {
        assertEquals(FailureKind.CONFIGURATION,
                selector.validate(SourceStrategy.PERIOD, "2024-01-01..soon").getFailure()
                        .getKind());
        assertEquals(FailureKind.CONFIGURATION,
                selector.validate(null, null).getFailure().getKind());
    }

    @Test
    void select_異常ケース_一覧取得が失敗する_IOExceptionが伝播すること() {
        store.failListingWith(new IOException("AccessDenied"));

        assertThrows(IOException.class,
                () -> selector.select("exports/{{DATE}}.csv", SourceStrategy.ALL, null));
    }

    @Test
    void listingPrefix_正常ケース_ディレクトリ部分が末尾スラッシュ込みで返ること() {
        assertEquals("a/b/", SourceSelector.listingPrefix("a/b/{{DATE}}.csv"));
        assertEquals("", SourceSelector.listingPrefix("{{DATE}}.csv"));
    }

    @Test
    void embeddedDate_正常ケース_ファイル名の日付が解析されること() {
        assertEquals(LocalDate.of(2024, 3, 15),
                SourceSelector.embeddedDate("x/y/2024-03-15.snappy.parquet"));
        assertNull(SourceSelector.embeddedDate("x/y/report.csv"));
    }
}
