package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.db.DbDialectHandler;
import io.github.yok.flexdbsync.util.JdbcConnections;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a synchronization run needs, built once at startup and handed to each component.
 *
 * <p>
 * Connections are not held here. Each operation opens the connections it needs through
 * {@link #openSource()} and {@link #openDestination()} and closes them before returning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class SyncContext {

    // Primary database settings
    @NonNull
    ConnectionConfig.Entry source;

    // Secondary database settings
    @NonNull
    ConnectionConfig.Entry destination;

    // Dialect of the primary database
    @NonNull
    DbDialectHandler sourceDialect;

    // Dialect of the secondary database
    @NonNull
    DbDialectHandler destinationDialect;

    // Tracking table name in the secondary database
    @NonNull
    String trackingTable;

    // Clock for tracking timestamps; expected to be in UTC
    @NonNull
    Clock clock;

    /**
     * Opens a read-only connection to the primary database.
     *
     * @return connection; the caller closes it
     * @throws SQLException if the connection cannot be opened
     */
    public Connection openSource() throws SQLException {
        return JdbcConnections.open(source, sourceDialect, true);
    }

    /**
     * Opens a connection to the secondary database in auto-commit mode.
     *
     * @return connection; the caller closes it
     * @throws SQLException if the connection cannot be opened
     */
    public Connection openDestination() throws SQLException {
        return JdbcConnections.open(destination, destinationDialect, false);
    }

    /**
     * Returns the current time of {@link #getClock()}.
     *
     * @return current wall-clock time
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
