package io.github.yok.clickload;

import io.github.yok.clickload.config.ConnectionConfig;
import io.github.yok.clickload.config.DriveConfig;
import io.github.yok.clickload.config.IngestConfig;
import io.github.yok.clickload.config.ObjectStoreConfig;
import io.github.yok.clickload.core.FailureKind;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.sql.QueryFileRunner;
import io.github.yok.clickload.sql.QueryVariables;
import io.github.yok.clickload.util.ErrorHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, overwrites the matching {@code ingest} settings of
 * {@code application.yml} and hands the run to {@link IngestionService}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --ingestor NAME} selects {@code tabular}, {@code object-store}, {@code download} or
 * {@code query}.</li>
 * <li>{@code --table NAME} (alias {@code --table-name}) names the destination table.</li>
 * <li>{@code --source PATTERN} (alias {@code --s3-path}) is the key pattern inside the
 * bucket.</li>
 * <li>{@code --strategy latest|period|all} (alias {@code --mode}) and {@code --period TOKEN}
 * (alias {@code --date}) select the objects.</li>
 * <li>{@code --create-table-sql}, {@code --insert-sql}, {@code --optimize-sql} and
 * {@code --queries a.sql,b.sql} name SQL files.</li>
 * <li>{@code --var NAME=VALUE} (alias {@code --override}) sets a SQL template variable.</li>
 * <li>{@code --skip-table-creation}, {@code --compact}, {@code --row-cap N},
 * {@code --watermark-column COL} and {@code --file-id ID} complete the set.</li>
 * </ul>
 *
 * <p>
 * Exit codes: {@code 0} success, {@code 1} failed run, {@code 2} configuration error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see IngestConfig
 * @see IngestionService
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, ObjectStoreConfig.class,
        DriveConfig.class, IngestConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;

    private final IngestConfig ingestConfig;
    private final IngestionService ingestionService;

    private int exitCode = EXIT_SUCCESS;

    /**
     * Bootstraps the application and exits with the code of the run.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", args.length);

        QueryVariables variables = QueryVariables.fromEnvironment(environment());
        try {
            parseArguments(args, variables);
        } catch (IllegalArgumentException e) {
            exitCode = EXIT_CONFIGURATION;
            ErrorHandler.fatal(e.getMessage());
            return;
        }

        Outcome<Void> outcome;
        try {
            outcome = ingestionService.execute(variables);
        } catch (RuntimeException e) {
            exitCode = EXIT_FAILURE;
            ErrorHandler.fatal("Fatal error (ingestor=" + ingestConfig.getIngestor() + ")", e);
            return;
        }

        if (outcome.isSuccess()) {
            exitCode = EXIT_SUCCESS;
            log.info("All operations completed successfully!");
        } else {
            exitCode = outcome.getFailure().getKind() == FailureKind.CONFIGURATION
                    ? EXIT_CONFIGURATION
                    : EXIT_FAILURE;
            ErrorHandler.fatal("Operation failed: " + outcome.getFailure());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Environment consulted for {@code CH_QUERY_VAR_*} variables.
     *
     * @return environment variables
     */
    Map<String, String> environment() {
        return System.getenv();
    }

    /**
     * Applies the command-line options to {@link IngestConfig} and the template variables.
     *
     * @param args command-line arguments
     * @param variables template variables receiving {@code --var} assignments
     * @throws IllegalArgumentException on a missing option value or a malformed number
     */
    void parseArguments(String[] args, QueryVariables variables) {
        List<String> queries = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--ingestor":
                    ingestConfig.setIngestor(value(args, ++i, "--ingestor"));
                    break;
                case "--table":
                case "--table-name":
                    ingestConfig.setTable(value(args, ++i, args[i - 1]));
                    break;
                case "--source":
                case "--s3-path":
                    ingestConfig.setSourcePath(value(args, ++i, args[i - 1]));
                    break;
                case "--strategy":
                case "--mode":
                    ingestConfig.setStrategy(value(args, ++i, args[i - 1]));
                    break;
                case "--period":
                case "--date":
                    ingestConfig.setPeriod(value(args, ++i, args[i - 1]));
                    break;
                case "--row-cap":
                    String cap = value(args, ++i, "--row-cap");
                    try {
                        ingestConfig.setRowCap(Integer.parseInt(cap.trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid --row-cap: " + cap, e);
                    }
                    break;
                case "--skip-table-creation":
                    ingestConfig.setSkipTableCreation(true);
                    break;
                case "--compact":
                    ingestConfig.setCompact(true);
                    break;
                case "--create-table-sql":
                    ingestConfig.setCreateTableSql(value(args, ++i, "--create-table-sql"));
                    break;
                case "--insert-sql":
                    ingestConfig.setInsertSql(value(args, ++i, "--insert-sql"));
                    break;
                case "--optimize-sql":
                    ingestConfig.setOptimizeSql(value(args, ++i, "--optimize-sql"));
                    break;
                case "--queries":
                    queries.addAll(QueryFileRunner.splitFileList(value(args, ++i, "--queries")));
                    break;
                case "--file-id":
                    ingestConfig.setFileId(value(args, ++i, "--file-id"));
                    break;
                case "--watermark-column":
                    ingestConfig.setWatermarkColumn(value(args, ++i, "--watermark-column"));
                    break;
                case "--var":
                case "--override":
                    variables.putAssignment(value(args, ++i, args[i - 1]));
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        // Command-line queries replace the configured list
        if (!queries.isEmpty()) {
            ingestConfig.setQueries(queries);
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
