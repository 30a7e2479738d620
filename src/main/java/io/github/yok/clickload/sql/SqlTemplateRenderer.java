package io.github.yok.clickload.sql;

import com.google.common.collect.ImmutableMap;
import io.github.yok.clickload.util.Diagnostics;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{NAME}}} placeholders in SQL templates.
 *
 * <p>
 * Every occurrence of {@code {{NAME}}} whose name has a value is replaced by that value, verbatim.
 * Placeholders without a value are left in place; {@link #render(String)} reports each distinct
 * unresolved name as a warning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlTemplateRenderer {

    // {{NAME}}; names are letters, digits and underscores
    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final Map<String, String> variables;
    private final Diagnostics diagnostics;

    public SqlTemplateRenderer(Map<String, String> variables, Diagnostics diagnostics) {
        this.variables = ImmutableMap.copyOf(variables);
        this.diagnostics = diagnostics;
    }

    /**
     * Expands a template and warns about unresolved placeholders.
     *
     * @param template SQL template
     * @return expanded SQL
     */
    public String render(String template) {
        String sql = expand(template, variables);
        Set<String> unresolved = placeholders(sql);
        if (!unresolved.isEmpty()) {
            diagnostics.warn("Unresolved SQL template variables left in place: {}", unresolved);
        }
        return sql;
    }

    /**
     * Pure expansion of a template.
     *
     * @param template SQL template
     * @param variables variable values by name
     * @return expanded SQL
     */
    public static String expand(String template, Map<String, String> variables) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * @param sql SQL text
     * @return distinct placeholder names still present, in order of appearance
     */
    public static Set<String> placeholders(String sql) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(sql);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }
}
