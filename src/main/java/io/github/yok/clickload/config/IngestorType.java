package io.github.yok.clickload.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Source families the front door can run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum IngestorType {

    // Store pulls a tabular file itself, driven by create/insert/optimize SQL files
    TABULAR("tabular", "csv"),

    // Objects selected from an object store
    OBJECT_STORE("object-store", "parquet", "s3"),

    // A single file from a remote download service
    DOWNLOAD("download", "gdrive"),

    // Plain SQL files, no ingestion
    QUERY("query");

    // Accepted names (lowercase)
    private final Set<String> names;

    IngestorType(String... names) {
        this.names = Arrays.stream(names).collect(Collectors.toSet());
    }

    /**
     * @param value configured value
     * @return type, or empty if unknown
     */
    public static Optional<IngestorType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.names.contains(key)).findFirst();
    }
}
