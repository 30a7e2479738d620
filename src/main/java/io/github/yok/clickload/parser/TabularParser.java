package io.github.yok.clickload.parser;

import com.google.common.base.Preconditions;
import io.github.yok.clickload.util.Diagnostics;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Turns delimited text into a {@link RawTable}.
 *
 * <p>
 * <strong>Rules:</strong>
 * </p>
 * <ul>
 * <li>Content is decoded as UTF-8. Records end at a newline; a double-quoted field may contain the
 * delimiter or line breaks.</li>
 * <li>The first record is the header. Header names are returned as read; cleaning is left to the
 * reconciler.</li>
 * <li>At most {@code rowCap} data rows are accepted. When more exist, the rest are dropped and a
 * truncation warning is emitted.</li>
 * <li>Records with the wrong number of fields are kept as they are.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class TabularParser {

    // Default row cap
    public static final int DEFAULT_ROW_CAP = 1_000_000;

    private final Diagnostics diagnostics;

    public TabularParser(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses CSV content with the default row cap.
     *
     * @param content raw bytes
     * @return parsed table
     * @throws IOException if the content is not well-formed delimited text
     */
    public RawTable parse(byte[] content) throws IOException {
        return parse(content, DataFormat.CSV, DEFAULT_ROW_CAP);
    }

    /**
     * Parses delimited content.
     *
     * @param content raw bytes
     * @param format delimited text format
     * @param rowCap maximum number of data rows to accept; must be positive
     * @return parsed table; header is empty when the content has no records
     * @throws IOException if the content is not well-formed delimited text
     */
    public RawTable parse(byte[] content, DataFormat format, int rowCap) throws IOException {
        Preconditions.checkArgument(format.isDelimitedText(), "%s is not a delimited text format",
                format);
        Preconditions.checkArgument(rowCap > 0, "rowCap must be positive: %s", rowCap);

        // Blank lines are records: they become all-empty rows, never dropped
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder().setDelimiter(format.getDelimiter())
                .setIgnoreEmptyLines(false).get();
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content),
                StandardCharsets.UTF_8); CSVParser parser = CSVParser.parse(reader, csvFormat)) {
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                return new RawTable(Collections.emptyList(), Collections.emptyList(), false);
            }
            List<String> header = it.next().toList();

            List<List<String>> rows = new ArrayList<>();
            while (it.hasNext() && rows.size() < rowCap) {
                rows.add(it.next().toList());
            }
            boolean truncated = it.hasNext();
            if (truncated) {
                diagnostics.warn("Reached maximum row limit of {}. Data truncated.", rowCap);
            }
            diagnostics.info("Parsed {} rows with {} columns", rows.size(), header.size());
            return new RawTable(header, rows, truncated);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
