package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.db.DbDialectHandler;
import io.github.yok.flexdbsync.model.SyncTrackingRecord;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes the tracking table of the destination database.
 *
 * <p>
 * The table holds one row per synchronized table:
 * </p>
 * <ul>
 * <li>{@code id}: surrogate key generated by the database</li>
 * <li>{@code table_name}: synchronized table name (unique)</li>
 * <li>{@code last_synced_at}: time of the last successful sync, in UTC</li>
 * </ul>
 *
 * <p>
 * Writes are upserts: the row of a table is updated when present and inserted otherwise.
 * Timestamps are bound as {@link LocalDateTime} so that no JVM time zone is applied on the way
 * in or out.
 * </p>
 *
 * <p>
 * A tracking table that already exists under a different letter case (for example
 * {@code SYNC_TRACKING} created without quotes) is used under the spelling the catalog reports.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SyncTrackingStore {

    private final SyncContext context;

    /**
     * Creates a store.
     *
     * @param context sync context
     */
    public SyncTrackingStore(SyncContext context) {
        this.context = context;
    }

    /**
     * Creates the tracking table when it does not exist yet.
     *
     * @throws SyncException if the destination cannot be reached or the DDL fails
     */
    public void ensureTrackingTable() {
        DbDialectHandler dialect = context.getDestinationDialect();
        String table = context.getTrackingTable();
        try (Connection conn = context.openDestination()) {
            String schema = dialect.resolveSchema(conn);
            Optional<String> existing = dialect.findTableName(conn, schema, table);
            if (existing.isPresent()) {
                log.info("Tracking table {} already exists", existing.get());
                return;
            }
            try (Statement st = conn.createStatement()) {
                st.execute(dialect.buildCreateTrackingTableSql(table));
            }
            log.info("Created tracking table {}", table);
        } catch (SQLException e) {
            throw new SyncException("Failed to create tracking table " + table, e);
        }
    }

    /**
     * Returns whether this is the first run: the tracking table is empty or cannot be read.
     *
     * @return {@code true} on first run
     */
    public boolean isFirstRun() {
        String table = context.getTrackingTable();
        try (Connection conn = context.openDestination()) {
            table = resolveTableName(conn);
            int count = context.getDestinationDialect().countRows(conn, table);
            log.debug("Tracking table {} holds {} record(s)", table, count);
            return count == 0;
        } catch (SQLException e) {
            TrackingReadException ex = new TrackingReadException(table, e);
            log.warn("{}; treating this run as the first run", ex.getMessage(), ex);
            return true;
        }
    }

    /**
     * Records the sync time of a table in a transaction of its own.
     *
     * @param tableName synchronized table name
     * @param syncedAt sync time (UTC)
     * @return write result; failures are returned, never thrown
     */
    public TrackingWriteResult recordSync(String tableName, LocalDateTime syncedAt) {
        try (Connection conn = context.openDestination()) {
            conn.setAutoCommit(false);
            try {
                upsert(conn, tableName, syncedAt);
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(conn);
                throw e;
            }
            log.info("Tracking updated: table={}, lastSyncedAt={}", tableName, syncedAt);
            return TrackingWriteResult.success(tableName);
        } catch (SQLException e) {
            TrackingWriteException ex = new TrackingWriteException(tableName, e);
            log.error(ex.getMessage(), ex);
            return TrackingWriteResult.failure(ex);
        }
    }

    /**
     * Records the sync time of a table inside a transaction owned by the caller.
     *
     * <p>
     * The upsert is guarded by a savepoint. On failure only the upsert is undone, so the caller's
     * transaction can still be committed.
     * </p>
     *
     * @param connection destination connection with auto-commit disabled
     * @param tableName synchronized table name
     * @param syncedAt sync time (UTC)
     * @return write result; failures are returned, never thrown
     */
    public TrackingWriteResult recordSync(Connection connection, String tableName,
            LocalDateTime syncedAt) {
        Savepoint savepoint = null;
        try {
            savepoint = connection.setSavepoint();
            upsert(connection, tableName, syncedAt);
            log.info("Tracking updated: table={}, lastSyncedAt={}", tableName, syncedAt);
            return TrackingWriteResult.success(tableName);
        } catch (SQLException e) {
            if (savepoint != null) {
                try {
                    connection.rollback(savepoint);
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback to savepoint failed: {}", rollbackEx.getMessage(),
                            rollbackEx);
                }
            }
            TrackingWriteException ex = new TrackingWriteException(tableName, e);
            log.error(ex.getMessage(), ex);
            return TrackingWriteResult.failure(ex);
        }
    }

    /**
     * Returns the record of a table.
     *
     * @param tableName synchronized table name
     * @return record, or empty when the table was never synchronized
     * @throws TrackingReadException if the tracking table cannot be read
     */
    public Optional<SyncTrackingRecord> find(String tableName) {
        try (Connection conn = context.openDestination()) {
            String sql = selectSql(conn) + " WHERE " + quote("table_name") + " = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, tableName);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
                }
            }
        } catch (SQLException e) {
            throw new TrackingReadException(context.getTrackingTable(), e);
        }
    }

    /**
     * Returns every record ordered by table name.
     *
     * @return records
     * @throws TrackingReadException if the tracking table cannot be read
     */
    public List<SyncTrackingRecord> findAll() {
        List<SyncTrackingRecord> records = new ArrayList<>();
        try (Connection conn = context.openDestination()) {
            String sql = selectSql(conn) + " ORDER BY " + quote("table_name");
            try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
                while (rs.next()) {
                    records.add(toRecord(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new TrackingReadException(context.getTrackingTable(), e);
        }
    }

    private void upsert(Connection conn, String tableName, LocalDateTime syncedAt)
            throws SQLException {
        String table = quote(resolveTableName(conn));
        String update = "UPDATE " + table + " SET " + quote("last_synced_at") + " = ? WHERE "
                + quote("table_name") + " = ?";
        int updated;
        try (PreparedStatement ps = conn.prepareStatement(update)) {
            ps.setObject(1, syncedAt);
            ps.setString(2, tableName);
            updated = ps.executeUpdate();
        }
        if (updated > 0) {
            return;
        }
        String insert = "INSERT INTO " + table + " (" + quote("table_name") + ", "
                + quote("last_synced_at") + ") VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(insert)) {
            ps.setString(1, tableName);
            ps.setObject(2, syncedAt);
            ps.executeUpdate();
        }
    }

    private String selectSql(Connection conn) throws SQLException {
        return "SELECT " + quote("table_name") + ", " + quote("last_synced_at") + " FROM "
                + quote(resolveTableName(conn));
    }

    private SyncTrackingRecord toRecord(ResultSet rs) throws SQLException {
        return new SyncTrackingRecord(rs.getString(1), rs.getObject(2, LocalDateTime.class));
    }

    // catalog spelling of the tracking table, or the configured name when it does not exist yet
    private String resolveTableName(Connection conn) throws SQLException {
        DbDialectHandler dialect = context.getDestinationDialect();
        String configured = context.getTrackingTable();
        return dialect.findTableName(conn, dialect.resolveSchema(conn), configured)
                .orElse(configured);
    }

    private String quote(String identifier) {
        return context.getDestinationDialect().quoteIdentifier(identifier);
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
            log.warn("Tracking transaction rolled back.");
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed: {}", rollbackEx.getMessage(), rollbackEx);
        }
    }
}
