package io.github.yok.clickload.sql;

import io.github.yok.clickload.parser.DataFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Helpers for {@code INSERT} statements.
 *
 * @author Yasuharu.Okawauchi
 */
public final class InsertStatements {

    private static final Pattern INSERT_TARGET =
            Pattern.compile("INSERT\\s+INTO\\s+([^\\s(]+)", Pattern.CASE_INSENSITIVE);

    @Generated
    private InsertStatements() {}

    /**
     * Extracts the target table of the first {@code INSERT INTO} in a statement.
     *
     * @param sql SQL text
     * @return table name as written (may be {@code db.table}); empty if none
     */
    public static Optional<String> extractTableName(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        Matcher m = INSERT_TARGET.matcher(sql);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Builds a statement that makes the store read an object itself through its {@code s3()} table
     * function.
     *
     * @param table destination table
     * @param objectUrl HTTPS URL of the object
     * @param accessKey access key; blank for anonymous access
     * @param secretKey secret key
     * @param format object format
     * @return {@code INSERT INTO ... SELECT * FROM s3(...)}
     */
    public static String storeSideLoad(String table, String objectUrl, String accessKey,
            String secretKey, DataFormat format) {
        StringBuilder sb = new StringBuilder("INSERT INTO ").append(table)
                .append(" SELECT * FROM s3(").append(literal(objectUrl));
        if (accessKey != null && !accessKey.isBlank()) {
            sb.append(", ").append(literal(accessKey)).append(", ").append(literal(secretKey));
        }
        sb.append(", ").append(literal(format.getStoreFormat())).append(")");
        return sb.toString();
    }

    /**
     * @param value raw value
     * @return single-quoted SQL string literal
     */
    static String literal(String value) {
        String v = value == null ? "" : value;
        return "'" + v.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
