package io.github.yok.clickload.core;

import io.github.yok.clickload.ingest.Ingestor;
import io.github.yok.clickload.ingest.SourcePayload;
import io.github.yok.clickload.parser.RawTable;
import io.github.yok.clickload.parser.TabularParser;
import io.github.yok.clickload.store.TableIntrospector;
import io.github.yok.clickload.store.TableStore;
import io.github.yok.clickload.util.Diagnostics;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Sequences one ingestion run for an {@link Ingestor}.
 *
 * <p>
 * <strong>Flow:</strong>
 * </p>
 * <ol>
 * <li>Validate the configuration (no external call).</li>
 * <li>Create the destination table unless skipped.</li>
 * <li>Resolve the source manifest; an empty manifest fails the run.</li>
 * <li>Count destination rows.</li>
 * <li>For each source, in manifest order: parse, reconcile, coerce and bulk-insert tabular content,
 * or execute the store-side load statement.</li>
 * <li>Count destination rows again and log the delta. The delta never decides success.</li>
 * <li>Compact the table when configured. A failing compaction is only logged.</li>
 * </ol>
 *
 * <p>
 * Any failure ends the run in {@link IngestionState#FAILED}. Sources inserted before the failure
 * stay inserted. Collaborator {@link IOException}s and {@link SQLException}s are caught here and
 * nowhere else. An interrupt is honoured between sources, never during an insert.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class IngestionOrchestrator {

    private final TableStore store;
    private final TableIntrospector introspector;
    private final TabularParser parser;
    private final SchemaReconciler reconciler;
    private final ValueCoercer coercer;
    private final Diagnostics diagnostics;

    private IngestionState state = IngestionState.INIT;
    private IngestionReport lastReport;

    /**
     * @param store destination store
     * @param diagnostics diagnostics sink shared with the parser, reconciler and coercer
     */
    public IngestionOrchestrator(TableStore store, Diagnostics diagnostics) {
        this(store, new TabularParser(diagnostics), new SchemaReconciler(diagnostics),
                new ValueCoercer(diagnostics), diagnostics);
    }

    /**
     * @param store destination store
     * @param parser tabular parser
     * @param reconciler schema reconciler
     * @param coercer value coercer
     * @param diagnostics diagnostics sink
     */
    public IngestionOrchestrator(TableStore store, TabularParser parser,
            SchemaReconciler reconciler, ValueCoercer coercer, Diagnostics diagnostics) {
        this.store = store;
        this.introspector = new TableIntrospector(store);
        this.parser = parser;
        this.reconciler = reconciler;
        this.coercer = coercer;
        this.diagnostics = diagnostics;
    }

    /**
     * Runs one ingestion.
     *
     * @param ingestor source family
     * @param options run options
     * @return {@code true} on success
     */
    public boolean run(Ingestor ingestor, IngestionOptions options) {
        state = IngestionState.INIT;
        lastReport = new IngestionReport(ingestor.describe());
        diagnostics.info("Starting ingestion: {}", ingestor.describe());
        try {
            Outcome<Void> valid = ingestor.validate(options);
            if (!valid.isSuccess()) {
                return fail(valid.getFailure());
            }

            prepareTable(ingestor, options);

            Outcome<SourceManifest> resolved = ingestor.resolveSources();
            if (!resolved.isSuccess()) {
                return fail(resolved.getFailure());
            }
            SourceManifest manifest = resolved.getValue();
            if (manifest.isEmpty()) {
                return fail(new IngestionFailure(FailureKind.SOURCE_RESOLUTION,
                        "No sources found for " + ingestor.describe()));
            }
            state = IngestionState.SOURCES_RESOLVED;

            Optional<String> table = ingestor.targetTable();
            String label = table.orElse(ingestor.describe());
            if (table.isPresent()) {
                long before = introspector.countRows(table.get());
                lastReport.setRowCountBefore(before);
                diagnostics.info("[{}] Row count before insert: {}", label, before);
            } else {
                diagnostics.warn("[{}] Destination table unknown; row counts are skipped", label);
            }

            DestinationSchema schema = null;
            for (String locator : manifest) {
                if (Thread.currentThread().isInterrupted()) {
                    return fail(new IngestionFailure(FailureKind.EXTERNAL_IO,
                            "Interrupted before source " + locator));
                }
                SourcePayload payload = ingestor.fetch(locator);
                if (payload.getKind() == SourcePayload.Kind.STORE_SIDE_LOAD) {
                    SourcePayload.StoreSideLoad load = (SourcePayload.StoreSideLoad) payload;
                    diagnostics.info("[{}] Executing store-side load for {}", label, locator);
                    store.execute(load.getStatement());
                } else {
                    if (table.isEmpty()) {
                        return fail(new IngestionFailure(FailureKind.CONFIGURATION,
                                "A destination table is required to insert " + locator));
                    }
                    if (schema == null) {
                        schema = introspector.describe(table.get());
                        diagnostics.info("[{}] Destination columns: {}", label, schema);
                    }
                    Outcome<Long> inserted = insertTabular(table.get(), schema,
                            (SourcePayload.TabularContent) payload, options);
                    if (!inserted.isSuccess()) {
                        return fail(inserted.getFailure());
                    }
                    lastReport.addRowsSent(inserted.getValue());
                }
                state = IngestionState.INSERTED;
                lastReport.incrementSourcesProcessed();
            }

            if (table.isPresent()) {
                long after = introspector.countRows(table.get());
                lastReport.setRowCountAfter(after);
                diagnostics.info("[{}] Row count after insert: {}", label, after);
                diagnostics.info("[{}] Rows inserted: {}", label, lastReport.rowDelta().orElse(0L));
                if (StringUtils.isNotBlank(options.getWatermarkColumn())) {
                    Optional<String> watermark =
                            introspector.maxValue(table.get(), options.getWatermarkColumn());
                    lastReport.setWatermark(watermark.orElse(null));
                    diagnostics.info("[{}] Latest {} loaded: {}", label,
                            options.getWatermarkColumn(), watermark.orElse("(none)"));
                }
            }
            state = IngestionState.VERIFIED;

            compact(ingestor, options, table);

            state = IngestionState.DONE;
            lastReport.setFinalState(IngestionState.DONE);
            diagnostics.info("[{}] Ingestion completed: {} source(s), {} row(s) sent", label,
                    lastReport.getSourcesProcessed(), lastReport.getRowsSent());
            return true;

        } catch (IOException | SQLException e) {
            diagnostics.error("Error in {} during {}: {}", ingestor.describe(), state,
                    e.getMessage(), e);
            return fail(new IngestionFailure(FailureKind.EXTERNAL_IO,
                    StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName())));
        }
    }

    /**
     * @return state of the current or last run
     */
    public IngestionState getState() {
        return state;
    }

    /**
     * @return report of the last run, or {@code null} before the first run
     */
    public IngestionReport getLastReport() {
        return lastReport;
    }

    private void prepareTable(Ingestor ingestor, IngestionOptions options)
            throws IOException, SQLException {
        if (options.isSkipTableCreation()) {
            diagnostics.info("Table creation skipped");
        } else {
            Optional<String> create = ingestor.createTableStatement();
            if (create.isPresent()) {
                store.execute(create.get());
            } else {
                diagnostics.info("No create-table statement; using the existing table");
            }
        }
        state = IngestionState.TABLE_READY;
    }

    private Outcome<Long> insertTabular(String table, DestinationSchema schema,
            SourcePayload.TabularContent payload, IngestionOptions options)
            throws IOException, SQLException {
        RawTable raw = parser.parse(payload.getContent(), payload.getFormat(), options.getRowCap());
        state = IngestionState.PARSED;
        if (!raw.hasHeader()) {
            return Outcome.failure(FailureKind.EMPTY_SOURCE,
                    "Source has no header: " + payload.getLocator());
        }
        if (raw.rowCount() == 0) {
            return Outcome.failure(FailureKind.EMPTY_SOURCE,
                    "Source has no data rows: " + payload.getLocator());
        }

        ColumnMapping mapping = reconciler.reconcile(raw.getHeader(), schema);
        state = IngestionState.RECONCILED;
        if (mapping.isEmpty()) {
            return Outcome.failure(FailureKind.STRUCTURAL_MISMATCH,
                    "No source column matches table " + table + ": " + payload.getLocator());
        }

        List<List<Object>> rows = new ArrayList<>(raw.rowCount());
        for (List<String> rawRow : raw.getRows()) {
            rows.add(coercer.coerceRow(rawRow, mapping));
        }
        state = IngestionState.COERCED;

        List<String> columns = mapping.destinationColumns();
        diagnostics.info("[{}] Inserting {} rows", table, rows.size());
        diagnostics.info("[{}] Using columns: {}", table, columns);
        diagnostics.info("[{}] Sample row: {}", table, rows.get(0));
        store.bulkInsert(table, columns, rows);
        return Outcome.success((long) rows.size());
    }

    private void compact(Ingestor ingestor, IngestionOptions options, Optional<String> table) {
        String statement;
        try {
            Optional<String> explicit = ingestor.compactionStatement();
            if (explicit.isPresent()) {
                statement = explicit.get();
            } else if (options.isCompact() && table.isPresent()) {
                statement = TableIntrospector.defaultCompaction(table.get());
            } else {
                return;
            }
            diagnostics.info("Compacting: {}", statement);
            store.execute(statement);
        } catch (IOException | SQLException e) {
            lastReport.setCompactionFailed(true);
            diagnostics.warn("Compaction failed; the loaded data is kept: {}", e.getMessage());
        }
    }

    private boolean fail(IngestionFailure failure) {
        diagnostics.error("Ingestion failed at {} ({}): {}", state, failure.getKind(),
                failure.getMessage());
        lastReport.setFailedAt(state);
        lastReport.setFailure(failure);
        lastReport.setFinalState(IngestionState.FAILED);
        state = IngestionState.FAILED;
        return false;
    }
}
