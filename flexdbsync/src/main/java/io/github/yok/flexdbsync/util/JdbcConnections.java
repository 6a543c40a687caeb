package io.github.yok.flexdbsync.util;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.db.DbDialectHandler;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC connections for a {@link ConnectionConfig.Entry}.
 *
 * <p>
 * When a driver class is configured it is loaded explicitly via {@link Class#forName(String)};
 * when blank, JDBC 4 auto-loading is used. Every connection is prepared by the dialect handler
 * before it is handed out.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class JdbcConnections {

    private JdbcConnections() {}

    /**
     * Opens a connection.
     *
     * @param entry connection settings
     * @param dialect dialect handler that prepares the session
     * @param readOnly whether to mark the connection read-only
     * @return open connection; the caller closes it
     * @throws SQLException if the driver is missing or the connection cannot be opened
     */
    public static Connection open(ConnectionConfig.Entry entry, DbDialectHandler dialect,
            boolean readOnly) throws SQLException {
        loadDriverIfConfigured(entry.getDriverClass());
        log.debug("[{}] Opening connection ({})", entry.getId(), MaskingLogUtil.describe(entry));
        Connection conn =
                DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        try {
            dialect.prepareConnection(conn);
            conn.setReadOnly(readOnly);
            return conn;
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    /**
     * Loads the JDBC driver class only when a class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws SQLException when the specified class cannot be found
     */
    static void loadDriverIfConfigured(String driverClass) throws SQLException {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
