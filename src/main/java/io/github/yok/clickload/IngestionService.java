package io.github.yok.clickload;

import io.github.yok.clickload.config.IngestConfig;
import io.github.yok.clickload.config.IngestorType;
import io.github.yok.clickload.config.ObjectStoreConfig;
import io.github.yok.clickload.core.FailureKind;
import io.github.yok.clickload.core.IngestionFailure;
import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.core.IngestionOrchestrator;
import io.github.yok.clickload.core.IngestionReport;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.core.SourceSelector;
import io.github.yok.clickload.ingest.DownloadIngestor;
import io.github.yok.clickload.ingest.Ingestor;
import io.github.yok.clickload.ingest.ObjectStoreIngestor;
import io.github.yok.clickload.ingest.TabularPathIngestor;
import io.github.yok.clickload.source.ObjectStore;
import io.github.yok.clickload.source.RemoteFileSource;
import io.github.yok.clickload.source.SourceClientFactory;
import io.github.yok.clickload.sql.QueryFileRunner;
import io.github.yok.clickload.sql.QueryVariables;
import io.github.yok.clickload.sql.SqlFileLoader;
import io.github.yok.clickload.sql.SqlTemplateRenderer;
import io.github.yok.clickload.store.TableStore;
import io.github.yok.clickload.store.TableStoreFactory;
import io.github.yok.clickload.util.Slf4jDiagnostics;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Front door of the ingestion engine: one entry point per source family, plus query mode.
 *
 * <p>
 * Each entry point opens its own store connection, wires the selected {@link Ingestor} into an
 * {@link IngestionOrchestrator} and reports success or a typed failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionService {

    static final String FILE_ID_VARIABLE = "GDRIVE_FILE_ID";

    static final String TABLE_VARIABLE = "TARGET_TABLE";

    private final IngestConfig ingestConfig;
    private final ObjectStoreConfig objectStoreConfig;
    private final TableStoreFactory tableStoreFactory;
    private final SourceClientFactory sourceClientFactory;

    /**
     * Runs the ingestor selected by {@code ingest.ingestor}.
     *
     * @param variables SQL template variables
     * @return success or the failure of the run
     */
    public Outcome<Void> execute(QueryVariables variables) {
        Optional<IngestorType> type = IngestorType.parse(ingestConfig.getIngestor());
        if (type.isEmpty()) {
            return Outcome.failure(FailureKind.CONFIGURATION, "Unknown ingestor: "
                    + ingestConfig.getIngestor() + "; expected tabular, object-store, download "
                    + "or query");
        }
        if (ingestConfig.getRowCap() <= 0) {
            return Outcome.failure(FailureKind.CONFIGURATION,
                    "Row cap must be positive: " + ingestConfig.getRowCap());
        }
        IngestionOptions options = new IngestionOptions(ingestConfig.isSkipTableCreation(),
                ingestConfig.isCompact(), ingestConfig.getRowCap(),
                ingestConfig.getWatermarkColumn());
        log.info("Ingestor: {}, options: {}", type.get(), options);

        List<String> queries = ingestConfig.getQueries();
        switch (type.get()) {
            case TABULAR:
                return ingestFromTabularPath(
                        firstNonBlank(ingestConfig.getCreateTableSql(), queries, 0),
                        firstNonBlank(ingestConfig.getInsertSql(), queries, 1),
                        firstNonBlank(ingestConfig.getOptimizeSql(), queries, 2), variables,
                        options);
            case OBJECT_STORE:
                return ingestFromObjectStore(ingestConfig.getSourcePath(),
                        ingestConfig.getStrategy(), ingestConfig.getPeriod(), variables, options);
            case DOWNLOAD:
                return ingestFromDownload(ingestConfig.getFileId(), ingestConfig.getTable(),
                        variables, options);
            case QUERY:
            default:
                return runQueries(queries, variables);
        }
    }

    /**
     * Statement-driven tabular ingestion.
     *
     * @param createTableSql create-table SQL file
     * @param insertSql insert SQL file
     * @param optimizeSql optional compaction SQL file
     * @param variables SQL template variables
     * @param options run options
     * @return success or failure
     */
    public Outcome<Void> ingestFromTabularPath(String createTableSql, String insertSql,
            String optimizeSql, QueryVariables variables, IngestionOptions options) {
        SqlFileLoader loader = loader(variables);
        return orchestrate(new TabularPathIngestor(createTableSql, insertSql, optimizeSql, loader),
                options);
    }

    /**
     * Object-store ingestion into {@code ingest.table}.
     *
     * @param pathPattern key pattern inside the bucket
     * @param strategy latest, period or all
     * @param period period token for strategy {@code period}
     * @param variables SQL template variables
     * @param options run options
     * @return success or failure
     */
    public Outcome<Void> ingestFromObjectStore(String pathPattern, String strategy, String period,
            QueryVariables variables, IngestionOptions options) {
        ObjectStore objectStore;
        try {
            objectStore = sourceClientFactory.objectStore();
        } catch (IllegalStateException e) {
            return Outcome.failure(FailureKind.CONFIGURATION, e.getMessage());
        }
        SourceSelector selector = new SourceSelector(objectStore,
                ingestConfig.getPeriodPlaceholder(),
                Slf4jDiagnostics.forClass(SourceSelector.class));
        String createTableSql =
                firstNonBlank(ingestConfig.getCreateTableSql(), ingestConfig.getQueries(), 0);
        Ingestor ingestor = new ObjectStoreIngestor(ingestConfig.getTable(), pathPattern, strategy,
                period, createTableSql, ingestConfig.getOptimizeSql(), objectStore, selector,
                loader(variables), objectStoreConfig.getAccessKey(),
                objectStoreConfig.getSecretKey());
        return orchestrate(ingestor, options);
    }

    /**
     * Remote download ingestion.
     *
     * @param fileId remote file ID
     * @param table destination table
     * @param variables SQL template variables
     * @param options run options
     * @return success or failure
     */
    public Outcome<Void> ingestFromDownload(String fileId, String table, QueryVariables variables,
            IngestionOptions options) {
        RemoteFileSource fileSource;
        try {
            fileSource = sourceClientFactory.remoteFileSource();
        } catch (IOException e) {
            return Outcome.failure(FailureKind.EXTERNAL_IO,
                    "Could not initialize the download client: " + e.getMessage());
        }
        // The file ID and table are exposed to the create and optimize templates
        QueryVariables downloadVariables = variables.copy();
        if (fileId != null) {
            downloadVariables.put(FILE_ID_VARIABLE, fileId);
        }
        if (table != null) {
            downloadVariables.put(TABLE_VARIABLE, table);
        }
        Ingestor ingestor = new DownloadIngestor(fileId, table, ingestConfig.getCreateTableSql(),
                ingestConfig.getOptimizeSql(), fileSource, loader(downloadVariables));
        return orchestrate(ingestor, options);
    }

    /**
     * Executes SQL files in order.
     *
     * @param files SQL file paths (entries may themselves be comma-separated)
     * @param variables SQL template variables
     * @return success or failure
     */
    public Outcome<Void> runQueries(List<String> files, QueryVariables variables) {
        List<String> paths = new ArrayList<>();
        for (String entry : files) {
            paths.addAll(QueryFileRunner.splitFileList(entry));
        }
        if (paths.isEmpty()) {
            return Outcome.failure(FailureKind.CONFIGURATION, "No queries specified");
        }
        for (String path : paths) {
            if (!SqlFileLoader.exists(path)) {
                return Outcome.failure(FailureKind.CONFIGURATION, "Query file not found: " + path);
            }
        }
        try (TableStore store = tableStoreFactory.open()) {
            boolean ok = new QueryFileRunner(store, loader(variables)).run(paths);
            return ok ? Outcome.success(null)
                    : Outcome.failure(FailureKind.EXTERNAL_IO, "Query execution failed");
        } catch (SQLException e) {
            return Outcome.failure(FailureKind.EXTERNAL_IO,
                    "Error connecting to ClickHouse: " + e.getMessage());
        }
    }

    private Outcome<Void> orchestrate(Ingestor ingestor, IngestionOptions options) {
        try (TableStore store = tableStoreFactory.open()) {
            IngestionOrchestrator orchestrator = new IngestionOrchestrator(store,
                    Slf4jDiagnostics.forClass(IngestionOrchestrator.class));
            if (orchestrator.run(ingestor, options)) {
                return Outcome.success(null);
            }
            IngestionReport report = orchestrator.getLastReport();
            IngestionFailure failure = report.getFailure();
            return Outcome.failure(failure != null ? failure
                    : new IngestionFailure(FailureKind.EXTERNAL_IO, "Ingestion failed"));
        } catch (SQLException e) {
            return Outcome.failure(FailureKind.EXTERNAL_IO,
                    "Error connecting to ClickHouse: " + e.getMessage());
        }
    }

    private SqlFileLoader loader(QueryVariables variables) {
        return new SqlFileLoader(new SqlTemplateRenderer(variables.asMap(),
                Slf4jDiagnostics.forClass(SqlTemplateRenderer.class)));
    }

    /**
     * Picks the explicit value, or else the entry at {@code index} of the fallback list.
     */
    static String firstNonBlank(String explicit, List<String> fallback, int index) {
        if (StringUtils.isNotBlank(explicit)) {
            return explicit;
        }
        if (fallback != null && fallback.size() > index) {
            return StringUtils.trimToNull(fallback.get(index));
        }
        return null;
    }
}
