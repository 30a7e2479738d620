package io.github.yok.clickload.store;

import io.github.yok.clickload.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Opens {@link TableStore} handles from {@link ConnectionConfig}.
 *
 * <p>
 * When a driver class is configured it is loaded explicitly; otherwise JDBC 4 auto-loading is
 * relied upon.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableStoreFactory {

    private final ConnectionConfig connectionConfig;

    /**
     * Opens a new connection to the destination store.
     *
     * @return connected store; the caller closes it
     * @throws SQLException if the driver is missing or the connection fails
     */
    public TableStore open() throws SQLException {
        if (StringUtils.isBlank(connectionConfig.getUrl())) {
            throw new SQLException("clickhouse.url is not configured");
        }
        loadDriver(connectionConfig.getDriverClass());
        log.info("Connecting to {} as {}", connectionConfig.getUrl(), connectionConfig.getUser());
        Connection connection = DriverManager.getConnection(connectionConfig.getUrl(),
                connectionConfig.getUser(), connectionConfig.getPassword());
        return new JdbcTableStore(connection);
    }

    static void loadDriver(String driverClass) throws SQLException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found: " + driverClass, e);
        }
    }
}
