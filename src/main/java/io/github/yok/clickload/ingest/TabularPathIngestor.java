package io.github.yok.clickload.ingest;

import io.github.yok.clickload.core.FailureKind;
import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.core.SourceManifest;
import io.github.yok.clickload.sql.InsertStatements;
import io.github.yok.clickload.sql.SqlFileLoader;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Statement-driven tabular ingestion: the store pulls the tabular file itself (for example through
 * a URL table function) as written in the insert SQL file.
 *
 * <p>
 * The destination table is taken from the {@code INSERT INTO} target of that statement. When it
 * cannot be found, row counting is skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TabularPathIngestor implements Ingestor {

    private final String createTableSql;
    private final String insertSql;
    private final String optimizeSql;
    private final SqlFileLoader loader;

    // Rendered insert statement, loaded once
    private String insertStatement;

    /**
     * @param createTableSql create-table SQL file; may be null when table creation is skipped
     * @param insertSql insert SQL file
     * @param optimizeSql optional compaction SQL file
     * @param loader SQL file loader
     */
    public TabularPathIngestor(String createTableSql, String insertSql, String optimizeSql,
            SqlFileLoader loader) {
        this.createTableSql = createTableSql;
        this.insertSql = insertSql;
        this.optimizeSql = optimizeSql;
        this.loader = loader;
    }

    @Override
    public String describe() {
        return "tabular(" + insertSql + ")";
    }

    @Override
    public Outcome<Void> validate(IngestionOptions options) {
        if (StringUtils.isBlank(insertSql)) {
            return Outcome.failure(FailureKind.CONFIGURATION,
                    "Missing required insert SQL file for the tabular ingestor");
        }
        if (!options.isSkipTableCreation() && StringUtils.isBlank(createTableSql)) {
            return Outcome.failure(FailureKind.CONFIGURATION,
                    "Missing required create-table SQL file for the tabular ingestor");
        }
        return IngestorChecks.filesExist(options.isSkipTableCreation() ? null : createTableSql,
                insertSql, optimizeSql);
    }

    @Override
    public Optional<String> targetTable() throws IOException {
        Optional<String> table = InsertStatements.extractTableName(insertStatement());
        if (table.isEmpty()) {
            log.warn("Could not find the INSERT INTO target in {}", insertSql);
        }
        return table;
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
        return Outcome.success(SourceManifest.of(insertSql));
    }

    @Override
    public SourcePayload fetch(String locator) throws IOException {
        log.info("Inserting data using {}", locator);
        return SourcePayload.storeSide(locator, insertStatement());
    }

    private String insertStatement() throws IOException {
        if (insertStatement == null) {
            insertStatement = loader.load(insertSql);
        }
        return insertStatement;
    }
}
