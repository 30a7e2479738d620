package io.github.yok.clickload.core;

import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Normalizes raw source header names before they are matched against the destination schema.
 *
 * <ol>
 * <li>remove byte-order marks ({@code U+FEFF})</li>
 * <li>strip leading/trailing whitespace</li>
 * <li>collapse each internal whitespace run to a single {@code _}</li>
 * <li>drop every remaining non-word character (Unicode-aware, so {@code Ä} survives)</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ColumnNameCleaner {

    private static final Pattern WHITESPACE_RUN =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern NON_WORD =
            Pattern.compile("[^\\w]", Pattern.UNICODE_CHARACTER_CLASS);

    @Generated
    private ColumnNameCleaner() {}

    /**
     * Cleans one header name.
     *
     * @param raw raw header value; {@code null} is treated as empty
     * @return cleaned name (possibly empty)
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String name = raw.replace("\uFEFF", "").strip();
        name = WHITESPACE_RUN.matcher(name).replaceAll("_");
        return NON_WORD.matcher(name).replaceAll("");
    }
}
