package io.github.yok.flexdbsync.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexdbsync.db.DbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.dbunit.operation.DatabaseOperation;

/**
 * Copies tables from the primary database to the secondary database by deleting every
 * destination row and inserting every source row.
 *
 * <p>
 * A call runs in two phases:
 * </p>
 * <ol>
 * <li><strong>mirror</strong>: each table is checked and, if needed, created in the destination
 * through {@link SchemaMirror}. DDL runs in auto-commit mode. A table that fails here is reported
 * and excluded from the batch.</li>
 * <li><strong>data</strong>: for each remaining table, rows are read from the source, the
 * destination is emptied with {@link DatabaseOperation#DELETE_ALL}, the rows are written with
 * {@link DatabaseOperation#INSERT}, and the sync time is recorded. All tables share one destination
 * transaction that is committed after the last table or rolled back on the first error.</li>
 * </ol>
 *
 * <p>
 * A failure on table N therefore also discards tables 1..N-1. A failed tracking write does not
 * abort the batch.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableSynchronizer {

    /**
     * Abstraction for DBUnit operations used by this synchronizer.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit DELETE_ALL.
         *
         * @param connection DBUnit connection
         * @param dataSet tables to empty
         * @throws Exception execution failure
         */
        void deleteAll(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet rows to write
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    private final SyncContext context;
    private final SchemaMirror schemaMirror;
    private final SyncTrackingStore trackingStore;

    // DBUnit operation executor (replaceable in tests)
    @Getter
    private final OperationExecutor operationExecutor;

    /**
     * Creates a synchronizer with default DBUnit operations.
     *
     * @param context sync context
     * @param schemaMirror schema mirror
     * @param trackingStore tracking store
     */
    public TableSynchronizer(SyncContext context, SchemaMirror schemaMirror,
            SyncTrackingStore trackingStore) {
        this(context, schemaMirror, trackingStore, new OperationExecutor() {
            @Override
            public void deleteAll(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.DELETE_ALL.execute(connection, dataSet);
            }

            @Override
            public void insert(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.INSERT.execute(connection, dataSet);
            }
        });
    }

    /**
     * Creates a synchronizer with the given DBUnit operations.
     *
     * @param context sync context
     * @param schemaMirror schema mirror
     * @param trackingStore tracking store
     * @param operationExecutor DBUnit operations
     */
    TableSynchronizer(SyncContext context, SchemaMirror schemaMirror,
            SyncTrackingStore trackingStore, OperationExecutor operationExecutor) {
        this.context = context;
        this.schemaMirror = schemaMirror;
        this.trackingStore = trackingStore;
        this.operationExecutor = operationExecutor;
    }

    /**
     * Synchronizes the given tables as one batch.
     *
     * @param tableNames table names in batch order
     * @return batch outcome; a batch failure is returned, not thrown
     */
    public SyncBatchResult syncTables(List<String> tableNames) {
        List<String> tables = ImmutableList.copyOf(tableNames);
        SyncBatchResult.SyncBatchResultBuilder result =
                SyncBatchResult.builder().requestedTables(tables);
        if (tables.isEmpty()) {
            log.info("No tables to synchronize.");
            return result.build();
        }

        String destId = context.getDestination().getId();
        log.info("[{}] Sync batch started: {}", destId, tables);
        Connection source = null;
        Connection destination = null;
        try {
            source = context.openSource();
            destination = context.openDestination();
            List<MirroredTable> mirrored = mirrorAll(source, destination, tables, result);
            if (mirrored.isEmpty()) {
                log.warn("[{}] Every table of the batch was skipped; nothing to copy.", destId);
                return result.build();
            }
            copyAll(source, destination, mirrored, tables, result);
        } catch (SQLException e) {
            SyncBatchException ex = new SyncBatchException(null, tables, e);
            log.error(ex.getMessage(), ex);
            result.error(ex);
        } finally {
            // the outcome is settled by commit or rollback; a close failure does not change it
            closeQuietly(destination, destId);
            closeQuietly(source, context.getSource().getId());
        }
        return result.build();
    }

    private void closeQuietly(Connection connection, String dbId) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to close connection: {}", dbId, e.getMessage(), e);
        }
    }

    private List<MirroredTable> mirrorAll(Connection source, Connection destination,
            List<String> tables, SyncBatchResult.SyncBatchResultBuilder result) {
        List<MirroredTable> mirrored = new ArrayList<>();
        for (String table : tables) {
            try {
                mirrored.add(schemaMirror.ensureTableMirrored(source, destination, table));
            } catch (SyncException e) {
                log.error("Skipping table {}: {}", table, e.getMessage(), e);
                result.skippedTable(table, e);
            }
        }
        return mirrored;
    }

    private void copyAll(Connection source, Connection destination, List<MirroredTable> mirrored,
            List<String> tables, SyncBatchResult.SyncBatchResultBuilder result)
            throws SQLException {
        String destId = context.getDestination().getId();
        DbDialectHandler sourceDialect = context.getSourceDialect();
        DbDialectHandler destDialect = context.getDestinationDialect();

        destination.setAutoCommit(false);
        String current = null;
        try {
            // created after mirroring so that DBUnit's cached table list includes new tables
            DatabaseConnection sourceDb = sourceDialect.createDbUnitConnection(source,
                    sourceDialect.resolveSchema(source));
            DatabaseConnection destDb = destDialect.createDbUnitConnection(destination,
                    destDialect.resolveSchema(destination));

            for (MirroredTable table : mirrored) {
                current = table.getRequestedName();
                String sourceName = table.getSource().getName();
                String destName = table.getDestinationName();
                log.info("[{}] Syncing table {}", destId, current);

                ITable rows = sourceDb.createQueryTable(destName,
                        "SELECT * FROM " + sourceDialect.quoteIdentifier(sourceName));
                operationExecutor.deleteAll(destDb,
                        new DefaultDataSet(new DefaultTable(destName)));
                operationExecutor.insert(destDb, new DefaultDataSet(rows));
                int count = rows.getRowCount();
                result.copiedTable(current, count);
                log.info("[{}] Table {} copied: {} row(s)", destId, current, count);

                result.trackingResult(
                        trackingStore.recordSync(destination, current, context.now()));
            }

            destination.commit();
            result.committed(true);
            log.info("[{}] Transaction committed (tables={})", destId, mirrored.size());
        } catch (Exception e) {
            try {
                destination.rollback();
                log.warn("[{}] Transaction rolled back due to error.", destId);
            } catch (SQLException rollbackEx) {
                log.warn("[{}] Rollback failed: {}", destId, rollbackEx.getMessage(),
                        rollbackEx);
            }
            SyncBatchException ex = new SyncBatchException(current, tables, e);
            log.error(ex.getMessage(), ex);
            result.error(ex);
        }
    }
}
