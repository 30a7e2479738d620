package io.github.yok.clickload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code clickhouse} section in {@code application.yml}.
 *
 * <p>
 * The defaults in {@code application.yml} fall back to the {@code CH_HOST}, {@code CH_PORT},
 * {@code CH_DB}, {@code CH_USER} and {@code CH_PASSWORD} environment variables.
 * </p>
 *
 * <pre>
 * clickhouse:
 *   url: jdbc:clickhouse://localhost:8123/default
 *   user: default
 *   password: ""
 *   driver-class: com.clickhouse.jdbc.ClickHouseDriver
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "clickhouse")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:clickhouse://localhost:8123/default)
    private String url;

    // Database user name
    private String user = "default";

    // Database password
    private String password = "";

    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass = "com.clickhouse.jdbc.ClickHouseDriver";

    @Override
    public String toString() {
        return "ConnectionConfig(url=" + url + ", user=" + user + ", password=***)";
    }
}
