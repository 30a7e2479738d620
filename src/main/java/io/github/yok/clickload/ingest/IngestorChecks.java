package io.github.yok.clickload.ingest;

import io.github.yok.clickload.core.FailureKind;
import io.github.yok.clickload.core.Outcome;
import io.github.yok.clickload.sql.SqlFileLoader;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Configuration checks shared by the ingestors.
 *
 * @author Yasuharu.Okawauchi
 */
final class IngestorChecks {

    @Generated
    private IngestorChecks() {}

    /**
     * Checks that every configured SQL file exists. Blank entries are not configured and skipped.
     *
     * @param paths SQL file paths
     * @return success, or a configuration failure naming the first missing file
     */
    static Outcome<Void> filesExist(String... paths) {
        for (String path : paths) {
            if (StringUtils.isNotBlank(path) && !SqlFileLoader.exists(path)) {
                return Outcome.failure(FailureKind.CONFIGURATION, "SQL file not found: " + path);
            }
        }
        return Outcome.success(null);
    }

    /**
     * @param value configured value
     * @param name option name for the message
     * @return success, or a configuration failure when the value is blank
     */
    static Outcome<Void> required(String value, String name) {
        if (StringUtils.isBlank(value)) {
            return Outcome.failure(FailureKind.CONFIGURATION, name + " is required");
        }
        return Outcome.success(null);
    }
}
