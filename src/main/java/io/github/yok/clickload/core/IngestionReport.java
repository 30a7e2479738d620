package io.github.yok.clickload.core;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * What happened during the last run of an {@link IngestionOrchestrator}.
 *
 * <p>
 * The row-count delta is an observability signal only: store-side deduplication or partition
 * overlap can make it differ from {@link #getRowsSent()} on a successful run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class IngestionReport {

    // Ingestor description
    private final String ingestor;

    // State the run ended in (DONE or FAILED)
    private IngestionState finalState = IngestionState.INIT;

    // Last state reached before failing; null on success
    private IngestionState failedAt;

    // Failure cause; null on success
    private IngestionFailure failure;

    // Sources fully inserted
    private int sourcesProcessed;

    // Rows handed to bulk inserts (store-side loads are not counted)
    private long rowsSent;

    // Destination row count before the first insert; null when not observed
    private Long rowCountBefore;

    // Destination row count after the last insert; null when not observed
    private Long rowCountAfter;

    // Maximum of the watermark column after the load; null when not configured or empty
    private String watermark;

    // Compaction ran and failed
    private boolean compactionFailed;

    IngestionReport(String ingestor) {
        this.ingestor = ingestor;
    }

    public boolean isSuccess() {
        return finalState == IngestionState.DONE;
    }

    /**
     * @return rows after minus rows before, when both were observed
     */
    public Optional<Long> rowDelta() {
        if (rowCountBefore == null || rowCountAfter == null) {
            return Optional.empty();
        }
        return Optional.of(rowCountAfter - rowCountBefore);
    }

    void incrementSourcesProcessed() {
        sourcesProcessed++;
    }

    void addRowsSent(long rows) {
        rowsSent += rows;
    }
}
