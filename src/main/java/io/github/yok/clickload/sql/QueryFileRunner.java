package io.github.yok.clickload.sql;

import io.github.yok.clickload.store.TableStore;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Executes plain SQL files in order.
 *
 * <p>
 * All files are loaded and rendered first, so a missing file stops the run before anything is
 * executed. Statements then run one by one; the first failure stops the run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class QueryFileRunner {

    private final TableStore store;
    private final SqlFileLoader loader;

    public QueryFileRunner(TableStore store, SqlFileLoader loader) {
        this.store = store;
        this.loader = loader;
    }

    /**
     * Splits a comma-separated list of file paths, dropping blanks.
     *
     * @param csv comma-separated paths
     * @return paths in order
     */
    public static List<String> splitFileList(String csv) {
        List<String> files = new ArrayList<>();
        if (csv == null) {
            return files;
        }
        for (String part : csv.split(",")) {
            if (StringUtils.isNotBlank(part)) {
                files.add(part.trim());
            }
        }
        return files;
    }

    /**
     * Loads and executes the files.
     *
     * @param files SQL file paths
     * @return {@code true} if every statement succeeded
     */
    public boolean run(List<String> files) {
        if (files.isEmpty()) {
            log.error("No queries specified");
            return false;
        }

        List<String> statements = new ArrayList<>();
        for (String file : files) {
            try {
                statements.add(loader.load(file));
            } catch (IOException e) {
                log.error("Query file could not be loaded: {} ({})", file, e.getMessage());
                return false;
            }
        }

        for (int i = 0; i < statements.size(); i++) {
            String sql = statements.get(i);
            try {
                log.info("Executing query from {}: {}...", files.get(i),
                        StringUtils.abbreviate(StringUtils.normalizeSpace(sql), 100));
                store.execute(sql);
            } catch (SQLException e) {
                log.error("Error executing query from {}: {}", files.get(i), e.getMessage());
                log.error("Failed query: {}", sql);
                return false;
            }
        }
        log.info("Executed {} queries", statements.size());
        return true;
    }
}
