package io.github.yok.clickload.parser;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Parsed, untyped content of one source: the raw header and the accepted rows.
 *
 * <p>
 * Rows may be shorter or longer than the header. {@code truncated} tells whether the row cap cut
 * rows off.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class RawTable {

    private final ImmutableList<String> header;
    private final ImmutableList<List<String>> rows;
    private final boolean truncated;

    public RawTable(List<String> header, List<List<String>> rows, boolean truncated) {
        this.header = ImmutableList.copyOf(header);
        ImmutableList.Builder<List<String>> builder = ImmutableList.builder();
        for (List<String> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
        this.truncated = truncated;
    }

    public boolean hasHeader() {
        return !header.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }
}
