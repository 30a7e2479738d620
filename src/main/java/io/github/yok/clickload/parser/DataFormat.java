package io.github.yok.clickload.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of source file formats.
 *
 * <p>
 * Delimited text formats are parsed in-process by {@link TabularParser}. The others are handed to
 * the table store, which reads the object itself; {@link #getStoreFormat()} is the name the store
 * uses for them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Comma-Separated Values.
    CSV(',', "CSVWithNames", "csv"),

    // Tab-Separated Values.
    TSV('\t', "TSVWithNames", "tsv", "tab"),

    // Apache Parquet, read by the store.
    PARQUET(null, "Parquet", "parquet"),

    // Apache ORC, read by the store.
    ORC(null, "ORC", "orc"),

    // Apache Avro, read by the store.
    AVRO(null, "Avro", "avro"),

    // Newline-delimited JSON, read by the store.
    NDJSON(null, "JSONEachRow", "ndjson", "jsonl");

    // Field delimiter for text formats; null for binary formats.
    private final Character delimiter;

    // Format name understood by the table store.
    private final String storeFormat;

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(Character delimiter, String storeFormat, String... exts) {
        this.delimiter = delimiter;
        this.storeFormat = storeFormat;
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * @return {@code true} if the format is delimited text parsed in-process
     */
    public boolean isDelimitedText() {
        return delimiter != null;
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Finds the format for a file extension.
     *
     * @param ext file extension (without dot)
     * @return matching format, if any
     */
    public static Optional<DataFormat> fromExtension(String ext) {
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }
}
