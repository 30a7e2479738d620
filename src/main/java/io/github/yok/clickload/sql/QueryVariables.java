package io.github.yok.clickload.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Template variables available to SQL files as {@code {{NAME}}}.
 *
 * <p>
 * Variables come from environment variables prefixed {@code CH_QUERY_VAR_} (prefix removed) and
 * from {@code --var NAME=VALUE} arguments, which take precedence. Values of names containing
 * {@code SECRET}, {@code PASSWORD}, {@code KEY} or {@code TOKEN} are never logged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class QueryVariables {

    // Prefix of environment variables exposed to SQL templates
    public static final String ENV_PREFIX = "CH_QUERY_VAR_";

    static final String REDACTED = "***REDACTED***";

    private static final String[] SENSITIVE_MARKERS = {"SECRET", "PASSWORD", "KEY", "TOKEN"};

    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * Collects the {@code CH_QUERY_VAR_*} entries of an environment map.
     *
     * @param environment environment variables, typically {@link System#getenv()}
     * @return variables, logged with secrets redacted
     */
    public static QueryVariables fromEnvironment(Map<String, String> environment) {
        QueryVariables vars = new QueryVariables();
        // Sorted for stable log output
        for (Map.Entry<String, String> e : new TreeMap<>(environment).entrySet()) {
            if (e.getKey().startsWith(ENV_PREFIX)) {
                String name = e.getKey().substring(ENV_PREFIX.length());
                vars.values.put(name, e.getValue());
                log.info("Loaded query variable: {}={}", name,
                        displayValue(e.getKey(), e.getValue()));
            }
        }
        return vars;
    }

    /**
     * Adds or overrides a variable.
     *
     * @param name variable name
     * @param value variable value
     * @return this
     */
    public QueryVariables put(String name, String value) {
        values.put(name, value);
        log.info("Set query variable: {}={}", name, displayValue(name, value));
        return this;
    }

    /**
     * Adds or overrides a variable from a {@code NAME=VALUE} assignment.
     *
     * @param assignment assignment text; the value may contain {@code =}
     * @return this
     * @throws IllegalArgumentException if the text has no {@code =} or an empty name
     */
    public QueryVariables putAssignment(String assignment) {
        int idx = assignment == null ? -1 : assignment.indexOf('=');
        if (idx <= 0) {
            throw new IllegalArgumentException("Expected NAME=VALUE, got: " + assignment);
        }
        return put(assignment.substring(0, idx).trim(), assignment.substring(idx + 1));
    }

    /**
     * @return independent copy; later changes to either side are not shared
     */
    public QueryVariables copy() {
        QueryVariables copy = new QueryVariables();
        copy.values.putAll(values);
        return copy;
    }

    public String get(String name) {
        return values.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * @return read-only view of the variables
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * @param name variable or environment variable name
     * @return {@code true} if values of this name must not be logged
     */
    public static boolean isSensitive(String name) {
        return name != null
                && StringUtils.containsAny(name.toUpperCase(Locale.ROOT), SENSITIVE_MARKERS);
    }

    static String displayValue(String name, String value) {
        return isSensitive(name) ? REDACTED : value;
    }
}
