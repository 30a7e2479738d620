package io.github.yok.clickload.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.clickload.config.SourceStrategy;
import io.github.yok.clickload.source.ObjectStore;
import io.github.yok.clickload.util.Diagnostics;
import io.github.yok.clickload.util.Periods;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the concrete objects to read for a path pattern and a {@link SourceStrategy}.
 *
 * <p>
 * <strong>Strategies:</strong>
 * </p>
 * <ul>
 * <li>{@link SourceStrategy#LATEST}: list the directory of the pattern, keep keys with the
 * pattern's extension, and pick the one whose file name carries the most recent
 * {@code YYYY-MM-DD} date. Names without a parseable date sort as the earliest date.</li>
 * <li>{@link SourceStrategy#PERIOD}: substitute the period into the pattern's placeholder. A period
 * of the form {@code START..END} yields one locator per day, ascending. No listing is done.</li>
 * <li>{@link SourceStrategy#ALL}: same listing and filtering as {@code LATEST}, every key in
 * listing order.</li>
 * </ul>
 *
 * <p>
 * Configuration problems (unknown strategy, missing period) are reported before the object store is
 * contacted. Listing errors propagate as {@link IOException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceSelector {

    private final ObjectStore objectStore;
    private final String periodPlaceholder;
    private final Diagnostics diagnostics;

    /**
     * @param objectStore listing capability
     * @param periodPlaceholder placeholder replaced by the period, e.g. {@code {{DATE}}}
     * @param diagnostics diagnostics sink
     */
    public SourceSelector(ObjectStore objectStore, String periodPlaceholder,
            Diagnostics diagnostics) {
        this.objectStore = objectStore;
        this.periodPlaceholder = periodPlaceholder;
        this.diagnostics = diagnostics;
    }

    /**
     * Checks the strategy/period combination without touching the object store.
     *
     * @param strategy strategy; {@code null} when the configured value was not recognized
     * @param period period value
     * @return success, or a {@link FailureKind#CONFIGURATION} failure
     */
    public Outcome<Void> validate(SourceStrategy strategy, String period) {
        if (strategy == null) {
            return Outcome.failure(FailureKind.CONFIGURATION,
                    "Unknown ingestion strategy; expected one of latest, period, all");
        }
        if (strategy == SourceStrategy.PERIOD) {
            if (StringUtils.isBlank(period)) {
                return Outcome.failure(FailureKind.CONFIGURATION,
                        "A period must be provided when the strategy is 'period'");
            }
            if (Periods.isRange(period)) {
                try {
                    Periods.range(period);
                } catch (IllegalArgumentException e) {
                    return Outcome.failure(FailureKind.CONFIGURATION, e.getMessage());
                }
            }
        }
        return Outcome.success(null);
    }

    /**
     * Resolves the manifest.
     *
     * @param pathPattern key pattern inside the bucket, e.g. {@code data/{{DATE}}.parquet}
     * @param strategy selection strategy
     * @param period period token; required for {@link SourceStrategy#PERIOD}
     * @return manifest of fully qualified locators, or a failure
     * @throws IOException if listing the object store fails
     */
    public Outcome<SourceManifest> select(String pathPattern, SourceStrategy strategy,
            String period) throws IOException {
        Outcome<Void> valid = validate(strategy, period);
        if (!valid.isSuccess()) {
            return Outcome.failure(valid.getFailure());
        }
        switch (strategy) {
            case PERIOD:
                return forPeriod(pathPattern, period.trim());
            case LATEST:
                return latest(pathPattern);
            case ALL:
            default:
                return all(pathPattern);
        }
    }

    /**
     * Derives the listing prefix: everything up to and including the last {@code /}.
     *
     * @param pathPattern key pattern
     * @return prefix; empty when the pattern has no directory part
     */
    static String listingPrefix(String pathPattern) {
        int idx = pathPattern.lastIndexOf('/');
        return idx < 0 ? "" : pathPattern.substring(0, idx + 1);
    }

    /**
     * Extracts the {@code YYYY-MM-DD} date embedded in the final segment of a key (text before the
     * first dot).
     *
     * @param key object key
     * @return parsed date, or {@code null}
     */
    static LocalDate embeddedDate(String key) {
        String name = key.substring(key.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return Periods.parseOrNull(dot < 0 ? name : name.substring(0, dot));
    }

    private Outcome<SourceManifest> forPeriod(String pathPattern, String period) {
        if (!pathPattern.contains(periodPlaceholder)) {
            diagnostics.warn("Path pattern {} has no {} placeholder; period {} is not applied",
                    pathPattern, periodPlaceholder, period);
        }
        List<String> periods;
        if (Periods.isRange(period)) {
            periods = Periods.range(period);
            if (periods.isEmpty()) {
                return Outcome.failure(FailureKind.SOURCE_RESOLUTION,
                        "Period range " + period + " is empty");
            }
        } else {
            if (!Periods.isValidDate(period)) {
                diagnostics.warn("Period {} is not a YYYY-MM-DD date; substituting it verbatim",
                        period);
            }
            periods = ImmutableList.of(period);
        }
        List<String> locators = periods.stream()
                .map(p -> objectStore.locatorFor(pathPattern.replace(periodPlaceholder, p)))
                .distinct().collect(Collectors.toList());
        diagnostics.info("Ingesting {} source(s) for period {}: {}", locators.size(), period,
                locators);
        return Outcome.success(SourceManifest.of(locators));
    }

    private Outcome<SourceManifest> latest(String pathPattern) throws IOException {
        String prefix = listingPrefix(pathPattern);
        Outcome<List<String>> candidates = candidates(pathPattern, prefix);
        if (!candidates.isSuccess()) {
            return Outcome.failure(candidates.getFailure());
        }

        List<String> keys = new ArrayList<>(candidates.getValue());
        boolean anyDated = false;
        for (String key : keys) {
            if (embeddedDate(key) == null) {
                diagnostics.warn("Could not parse date from file name: {}", key);
            } else {
                anyDated = true;
            }
        }
        if (!anyDated) {
            return Outcome.failure(FailureKind.SOURCE_RESOLUTION,
                    "No file with a YYYY-MM-DD date in its name under " + describe(prefix));
        }

        // List.sort is stable; equal dates keep listing order
        keys.sort(Comparator.comparing((String key) -> {
            LocalDate date = embeddedDate(key);
            return date == null ? LocalDate.MIN : date;
        }).reversed());
        String latest = objectStore.locatorFor(keys.get(0));
        diagnostics.info("Latest file: {}", latest);
        return Outcome.success(SourceManifest.of(latest));
    }

    private Outcome<SourceManifest> all(String pathPattern) throws IOException {
        String prefix = listingPrefix(pathPattern);
        Outcome<List<String>> candidates = candidates(pathPattern, prefix);
        if (!candidates.isSuccess()) {
            return Outcome.failure(candidates.getFailure());
        }
        List<String> locators = candidates.getValue().stream().map(objectStore::locatorFor)
                .collect(Collectors.toList());
        diagnostics.info("Ingesting {} files", locators.size());
        return Outcome.success(SourceManifest.of(locators));
    }

    private Outcome<List<String>> candidates(String pathPattern, String prefix)
            throws IOException {
        diagnostics.info("Listing files in {}", describe(prefix));
        List<String> keys = objectStore.listObjects(prefix);
        if (keys.isEmpty()) {
            return Outcome.failure(FailureKind.SOURCE_RESOLUTION,
                    "No files found in " + describe(prefix));
        }

        String extension = FilenameUtils.getExtension(pathPattern);
        if (extension.isEmpty()) {
            return Outcome.success(keys);
        }
        String suffix = "." + extension.toLowerCase(Locale.ROOT);
        List<String> matching = keys.stream()
                .filter(k -> k.toLowerCase(Locale.ROOT).endsWith(suffix))
                .collect(Collectors.toList());
        if (matching.isEmpty()) {
            return Outcome.failure(FailureKind.SOURCE_RESOLUTION,
                    "No " + suffix + " files found in " + describe(prefix));
        }
        diagnostics.info("Found {} {} files. First few: {}", matching.size(), suffix,
                matching.subList(0, Math.min(3, matching.size())));
        return Outcome.success(matching);
    }

    private String describe(String prefix) {
        return objectStore.getBucket() + "/" + prefix;
    }
}
