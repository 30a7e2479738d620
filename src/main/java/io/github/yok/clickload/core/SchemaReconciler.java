package io.github.yok.clickload.core;

import io.github.yok.clickload.util.Diagnostics;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches the raw header of an uncontrolled source against the authoritative destination schema.
 *
 * <p>
 * Header names are cleaned once with {@link ColumnNameCleaner}. Matching then runs in two passes:
 * </p>
 * <ol>
 * <li><strong>exact</strong>: cleaned name equals a destination column name (case-sensitive);</li>
 * <li><strong>case-insensitive</strong>: attempted only when pass 1 matched nothing; the mapped
 * name is the destination's canonical casing.</li>
 * </ol>
 *
 * <p>
 * Source columns that match nothing are dropped silently, so sources carrying extra or drifted
 * columns still load. When both passes match nothing the empty mapping is returned.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaReconciler {

    private final Diagnostics diagnostics;

    public SchemaReconciler(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Reconciles a raw header against the destination schema.
     *
     * @param rawHeader header names as read from the source (not yet cleaned)
     * @param schema destination schema
     * @return column mapping; empty when no column matched
     */
    public ColumnMapping reconcile(List<String> rawHeader, DestinationSchema schema) {
        List<String> cleaned = rawHeader.stream().map(ColumnNameCleaner::clean)
                .collect(Collectors.toList());
        diagnostics.info("Source columns (cleaned): {}", cleaned);

        List<ColumnMapping.Entry> exact = matchExact(cleaned, schema);
        if (!exact.isEmpty()) {
            return new ColumnMapping(exact, ColumnMapping.MatchPhase.EXACT);
        }

        List<ColumnMapping.Entry> relaxed = matchIgnoringCase(cleaned, schema);
        if (!relaxed.isEmpty()) {
            diagnostics.info("No exact column match; matched {} column(s) ignoring case",
                    relaxed.size());
            return new ColumnMapping(relaxed, ColumnMapping.MatchPhase.CASE_INSENSITIVE);
        }

        diagnostics.warn("No matching columns between source and table. Source: {}, Table: {}",
                cleaned, schema.columnNames());
        return ColumnMapping.empty();
    }

    private List<ColumnMapping.Entry> matchExact(List<String> cleaned, DestinationSchema schema) {
        List<ColumnMapping.Entry> entries = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < cleaned.size(); i++) {
            String name = cleaned.get(i);
            if (schema.contains(name)) {
                addUnique(entries, taken, i, name, schema);
            }
        }
        return entries;
    }

    private List<ColumnMapping.Entry> matchIgnoringCase(List<String> cleaned,
            DestinationSchema schema) {
        Map<String, String> lowerToCanonical = new LinkedHashMap<>();
        for (String column : schema.columnNames()) {
            lowerToCanonical.putIfAbsent(column.toLowerCase(Locale.ROOT), column);
        }

        List<ColumnMapping.Entry> entries = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < cleaned.size(); i++) {
            String canonical = lowerToCanonical.get(cleaned.get(i).toLowerCase(Locale.ROOT));
            if (canonical != null) {
                addUnique(entries, taken, i, canonical, schema);
            }
        }
        return entries;
    }

    private void addUnique(List<ColumnMapping.Entry> entries, Set<String> taken, int sourceIndex,
            String destination, DestinationSchema schema) {
        if (!taken.add(destination)) {
            diagnostics.warn("Source column #{} maps to [{}] again; keeping the first occurrence",
                    sourceIndex, destination);
            return;
        }
        entries.add(new ColumnMapping.Entry(sourceIndex, destination,
                schema.typeOf(destination).orElse(SemanticType.TEXT)));
    }
}
