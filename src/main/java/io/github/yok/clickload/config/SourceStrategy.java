package io.github.yok.clickload.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * How the source selector picks objects under a path pattern.
 *
 * <p>
 * Each strategy has one or more names accepted on the command line and in {@code application.yml};
 * {@code date} is kept as an alias of {@link #PERIOD}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceStrategy {

    // Most recent object by the date embedded in its file name
    LATEST("latest"),

    // Exactly the object(s) for a given period token
    PERIOD("period", "date"),

    // Every matching object
    ALL("all");

    // Accepted names (lowercase)
    private final Set<String> names;

    SourceStrategy(String... names) {
        this.names = Arrays.stream(names).collect(Collectors.toSet());
    }

    /**
     * Resolves a strategy by name, ignoring case and surrounding whitespace.
     *
     * @param value configured value
     * @return strategy, or empty if the value is null or not a known name
     */
    public static Optional<SourceStrategy> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.names.contains(key)).findFirst();
    }
}
