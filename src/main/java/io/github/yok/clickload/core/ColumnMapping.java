package io.github.yok.clickload.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of reconciling a raw source header against a {@link DestinationSchema}.
 *
 * <p>
 * Holds one {@link Entry} per matched source column, ordered by first-seen source index.
 * Destination names are unique and all present in the schema. An empty mapping is the defined
 * "nothing matched" outcome, not an error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ColumnMapping {

    /**
     * Which matching pass produced the mapping.
     */
    public enum MatchPhase {
        // Cleaned source name equals a destination name (case-sensitive)
        EXACT,
        // Lower-cased cleaned source name equals a lower-cased destination name
        CASE_INSENSITIVE,
        // Neither pass matched anything
        NONE
    }

    /**
     * One matched column: source position, canonical destination name and destination type.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    @AllArgsConstructor
    public static final class Entry {
        private final int sourceIndex;
        private final String destinationColumn;
        private final SemanticType type;
    }

    private final ImmutableList<Entry> entries;
    private final MatchPhase phase;

    public ColumnMapping(List<Entry> entries, MatchPhase phase) {
        this.entries = ImmutableList.copyOf(entries);
        this.phase = phase;
    }

    /**
     * @return the empty mapping
     */
    public static ColumnMapping empty() {
        return new ColumnMapping(ImmutableList.of(), MatchPhase.NONE);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return destination column names in mapping order, used as the insert column list
     */
    public List<String> destinationColumns() {
        return entries.stream().map(Entry::getDestinationColumn).collect(Collectors.toList());
    }
}
