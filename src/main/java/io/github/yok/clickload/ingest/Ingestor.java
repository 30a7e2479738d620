package io.github.yok.clickload.ingest;

import io.github.yok.clickload.core.IngestionOptions;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.core.SourceManifest;
import java.io.IOException;
import java.util.Optional;

/**
 * One source family, driven by {@link io.github.yok.clickload.core.IngestionOrchestrator}.
 *
 * <p>
 * Variants share only the orchestrator's sequencing. Each one says which table it targets, which
 * statements prepare and compact it, which sources to read and how to fetch each of them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see TabularPathIngestor
 * @see ObjectStoreIngestor
 * @see DownloadIngestor
 */
public interface Ingestor {

    /**
     * @return short description for logs
     */
    String describe();

    /**
     * Checks the configuration without any external call.
     *
     * @param options run options
     * @return success, or a {@link io.github.yok.clickload.core.FailureKind#CONFIGURATION} failure
     */
    Outcome<Void> validate(IngestionOptions options);

    /**
     * @return destination table, when known; used for row counting, introspection and compaction
     * @throws IOException if a statement file must be read to find it and cannot be
     */
    Optional<String> targetTable() throws IOException;

    /**
     * @return rendered create-table statement, if the ingestor has one
     * @throws IOException if the statement file cannot be read
     */
    Optional<String> createTableStatement() throws IOException;

    /**
     * @return rendered compaction statement configured explicitly, if any
     * @throws IOException if the statement file cannot be read
     */
    Optional<String> compactionStatement() throws IOException;

    /**
     * Resolves the sources to read.
     *
     * @return manifest, or a failure
     * @throws IOException if listing fails
     */
    Outcome<SourceManifest> resolveSources() throws IOException;

    /**
     * Fetches one source.
     *
     * @param locator manifest entry
     * @return payload
     * @throws IOException if the download or statement loading fails
     */
    SourcePayload fetch(String locator) throws IOException;
}
