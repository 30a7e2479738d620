package io.github.yok.clickload.ingest;

import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.core.SourceManifest;
import io.github.yok.clickload.parser.DataFormat;
import io.github.yok.clickload.source.RemoteFileMetadata;
import io.github.yok.clickload.source.RemoteFileSource;
import io.github.yok.clickload.sql.SqlFileLoader;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Ingests one spreadsheet export from a remote download service.
 *
 * <p>
 * The file is read as CSV unless its name ends in {@code .tsv}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DownloadIngestor implements Ingestor {

    private final String fileId;
    private final String table;
    private final String createTableSql;
    private final String optimizeSql;
    private final RemoteFileSource fileSource;
    private final SqlFileLoader loader;

    /**
     * @param fileId remote file ID
     * @param table destination table
     * @param createTableSql create-table SQL file
     * @param optimizeSql optional compaction SQL file
     * @param fileSource remote file source
     * @param loader SQL file loader
     */
    public DownloadIngestor(String fileId, String table, String createTableSql, String optimizeSql,
            RemoteFileSource fileSource, SqlFileLoader loader) {
        this.fileId = fileId;
        this.table = table;
        this.createTableSql = createTableSql;
        this.optimizeSql = optimizeSql;
        this.fileSource = fileSource;
        this.loader = loader;
    }

    @Override
    public String describe() {
        return "download(" + fileId + ")";
    }

    @Override
    public Outcome<Void> validate(IngestionOptions options) {
        Outcome<Void> check = IngestorChecks.required(fileId, "File ID");
        if (check.isSuccess()) {
            check = IngestorChecks.required(table, "Destination table");
        }
        if (check.isSuccess() && !options.isSkipTableCreation()) {
            check = IngestorChecks.required(createTableSql, "Create-table SQL file");
        }
        if (check.isSuccess()) {
            check = IngestorChecks.filesExist(options.isSkipTableCreation() ? null : createTableSql,
                    optimizeSql);
        }
        return check;
    }

    @Override
    public Optional<String> targetTable() {
        return Optional.of(table);
    }

    @Override
    public Optional<String> createTableStatement() throws IOException {
        if (StringUtils.isBlank(createTableSql)) {
            return Optional.empty();
        }
        log.info("Creating table using {}", createTableSql);
        return Optional.of(loader.load(createTableSql));
    }

    @Override
    public Optional<String> compactionStatement() throws IOException {
        if (StringUtils.isBlank(optimizeSql)) {
            return Optional.empty();
        }
        log.info("Optimizing table using {}", optimizeSql);
        return Optional.of(loader.load(optimizeSql));
    }

    @Override
    public Outcome<SourceManifest> resolveSources() {
        return Outcome.success(SourceManifest.of(fileId));
    }

    @Override
    public SourcePayload fetch(String locator) throws IOException {
        RemoteFileMetadata metadata = fileSource.getMetadata(locator);
        log.info("Downloading file: {} (ID: {})", metadata.getName(), locator);
        byte[] content = fileSource.download(locator);
        log.info("Download complete: {} ({} bytes)", metadata.getName(), content.length);

        DataFormat format = DataFormat.TSV.matches(FilenameUtils.getExtension(metadata.getName()))
                ? DataFormat.TSV
                : DataFormat.CSV;
        return SourcePayload.tabular(locator, content, format);
    }
}
