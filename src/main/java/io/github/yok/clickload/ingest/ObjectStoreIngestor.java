package io.github.yok.clickload.ingest;

import io.github.yok.clickload.config.SourceStrategy;
import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.core.SourceManifest;
import io.github.yok.clickload.core.SourceSelector;
import io.github.yok.clickload.parser.DataFormat;
import io.github.yok.clickload.source.ObjectStore;
import io.github.yok.clickload.sql.InsertStatements;
import io.github.yok.clickload.sql.SqlFileLoader;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Ingests objects selected from an object store.
 *
 * <p>
 * Delimited text objects ({@code .csv}, {@code .tsv}) are downloaded and go through
 * parse, reconcile, coerce and bulk insert. Other objects are loaded by the store itself through
 * its {@code s3()} table function; an unrecognized extension is treated as Parquet.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ObjectStoreIngestor implements Ingestor {

    private final String table;
    private final String pathPattern;
    private final String strategy;
    private final String period;
    private final String createTableSql;
    private final String optimizeSql;
    private final ObjectStore objectStore;
    private final SourceSelector selector;
    private final SqlFileLoader loader;
    private final String accessKey;
    private final String secretKey;

    /**
     * @param table destination table
     * @param pathPattern key pattern inside the bucket
     * @param strategy configured strategy name
     * @param period period token (strategy {@code period} only)
     * @param createTableSql create-table SQL file
     * @param optimizeSql optional compaction SQL file
     * @param objectStore object store handle
     * @param selector source selector over the same store
     * @param loader SQL file loader
     * @param accessKey access key passed to the store for store-side loads
     * @param secretKey secret key passed to the store for store-side loads
     */
    public ObjectStoreIngestor(String table, String pathPattern, String strategy, String period,
            String createTableSql, String optimizeSql, ObjectStore objectStore,
            SourceSelector selector, SqlFileLoader loader, String accessKey, String secretKey) {
        this.table = table;
        this.pathPattern = pathPattern;
        this.strategy = strategy;
        this.period = period;
        this.createTableSql = createTableSql;
        this.optimizeSql = optimizeSql;
        this.objectStore = objectStore;
        this.selector = selector;
        this.loader = loader;
        this.accessKey = accessKey;
        this.secretKey = secretKey;
    }

    @Override
    public String describe() {
        return "object-store(" + objectStore.getBucket() + "/" + pathPattern + ", " + strategy
                + ")";
    }

    @Override
    public Outcome<Void> validate(IngestionOptions options) {
        Outcome<Void> check = IngestorChecks.required(table, "Destination table");
        if (check.isSuccess()) {
            check = IngestorChecks.required(pathPattern, "Source path");
        }
        if (check.isSuccess() && !options.isSkipTableCreation()) {
            check = IngestorChecks.required(createTableSql, "Create-table SQL file");
        }
        if (check.isSuccess()) {
            check = selector.validate(SourceStrategy.parse(strategy).orElse(null), period);
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
    public Outcome<SourceManifest> resolveSources() throws IOException {
        return selector.select(pathPattern, SourceStrategy.parse(strategy).orElse(null), period);
    }

    @Override
    public SourcePayload fetch(String locator) throws IOException {
        String key = objectStore.keyOf(locator);
        DataFormat format = DataFormat.fromExtension(FilenameUtils.getExtension(key))
                .orElse(DataFormat.PARQUET);
        if (format.isDelimitedText()) {
            return SourcePayload.tabular(locator, objectStore.download(key), format);
        }
        log.info("Inserting data from {}", locator);
        return SourcePayload.storeSide(locator, InsertStatements.storeSideLoad(table,
                objectStore.objectUrl(key), accessKey, secretKey, format));
    }
}
