package io.github.yok.clickload.config;

import io.github.yok.clickload.parser.TabularParser;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code ingest} section in {@code application.yml}.
 *
 * <p>
 * Command-line options parsed by {@link io.github.yok.clickload.Main} overwrite these values before
 * the run starts.
 * </p>
 *
 * <pre>
 * ingest:
 *   ingestor: object-store
 *   table: events
 *   source-path: exports/events/{{DATE}}.parquet
 *   strategy: latest
 *   create-table-sql: queries/events/create_table.sql
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestConfig {

    // Source family: tabular, object-store, download or query
    private String ingestor = "query";

    // Destination table (required for object-store and download)
    private String table;

    // Key pattern inside the bucket, may contain the period placeholder
    private String sourcePath;

    // latest, period (alias date) or all
    private String strategy = "latest";

    // Period token (YYYY-MM-DD or START..END); required when strategy is period
    private String period;

    // Placeholder in sourcePath replaced by the period
    private String periodPlaceholder = "{{DATE}}";

    // Maximum number of data rows accepted from one parsed source
    private int rowCap = TabularParser.DEFAULT_ROW_CAP;

    // Skip the create-table statement
    private boolean skipTableCreation = false;

    // Run the compaction statement after a successful load
    private boolean compact = false;

    // SQL file creating the destination table
    private String createTableSql;

    // SQL file with the insert statement (tabular ingestor)
    private String insertSql;

    // SQL file with the compaction statement; OPTIMIZE TABLE ... FINAL when blank
    private String optimizeSql;

    // SQL files run in order (query ingestor)
    // The tabular ingestor reads create, insert and optimize from here when not set explicitly
    private List<String> queries = new ArrayList<>();

    // Remote file ID (download ingestor)
    private String fileId;

    // Column whose maximum is logged after the load
    private String watermarkColumn;
}
