package io.github.yok.clickload.core;

import io.github.yok.clickload.parser.TabularParser;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-run switches of the orchestrator.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionOptions {

    // Skip the create-table statement
    private boolean skipTableCreation = false;

    // Compact the table after a successful load even without an explicit statement
    private boolean compact = false;

    // Maximum number of data rows accepted from one parsed source
    private int rowCap = TabularParser.DEFAULT_ROW_CAP;

    // Column whose maximum is logged after the load, e.g. the event date; none when blank
    private String watermarkColumn;
}
