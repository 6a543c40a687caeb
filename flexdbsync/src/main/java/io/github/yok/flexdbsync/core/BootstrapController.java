package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.model.SyncTrackingRecord;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one synchronization at startup.
 *
 * <p>
 * Steps:
 * </p>
 * <ol>
 * <li>Verify that every requested table exists in the primary database. Missing tables are
 * logged and left out; the others continue.</li>
 * <li>Create the tracking table in the secondary database if needed.</li>
 * <li>Decide whether this is the first run.</li>
 * <li>Synchronize the verified tables. Every run is a full resync, first run or not.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 * @see SyncState
 */
@Slf4j
public class BootstrapController {

    private final SyncContext context;
    private final SchemaIntrospector introspector;
    private final SyncTrackingStore trackingStore;
    private final TableSynchronizer synchronizer;

    /**
     * Creates a controller with the default components for the context.
     *
     * @param context sync context
     */
    public BootstrapController(SyncContext context) {
        this(context, new SchemaIntrospector(), new SyncTrackingStore(context));
    }

    private BootstrapController(SyncContext context, SchemaIntrospector introspector,
            SyncTrackingStore trackingStore) {
        this(context, introspector, trackingStore, new TableSynchronizer(context,
                new SchemaMirror(context, introspector), trackingStore));
    }

    /**
     * Creates a controller with the given components.
     *
     * @param context sync context
     * @param introspector metadata reader
     * @param trackingStore tracking store
     * @param synchronizer table synchronizer
     */
    public BootstrapController(SyncContext context, SchemaIntrospector introspector,
            SyncTrackingStore trackingStore, TableSynchronizer synchronizer) {
        this.context = context;
        this.introspector = introspector;
        this.trackingStore = trackingStore;
        this.synchronizer = synchronizer;
    }

    /**
     * Runs the bootstrap sequence.
     *
     * @param tableNames requested tables in batch order
     * @return run outcome; failures are returned, not thrown
     */
    public BootstrapResult run(List<String> tableNames) {
        BootstrapResult.BootstrapResultBuilder result = BootstrapResult.builder();
        SyncState state = SyncState.INIT;
        log.info("Bootstrap started: state={}, tables={}", state, tableNames);

        List<String> verified = new ArrayList<>();
        try (Connection source = context.openSource()) {
            for (String table : tableNames) {
                if (introspector.exists(source, context.getSourceDialect(), table)) {
                    verified.add(table);
                } else {
                    SchemaIntrospectionException e = new SchemaIntrospectionException(table,
                            "Table " + table + " does not exist in the source database");
                    log.error(e.getMessage());
                    result.missingTable(table);
                }
            }
        } catch (SQLException e) {
            return fail(result, state, new SyncException("Cannot connect to the source database",
                    e));
        } catch (SyncException e) {
            return fail(result, state, e);
        }
        state = transition(state, SyncState.SCHEMA_CHECKED);

        try {
            trackingStore.ensureTrackingTable();
        } catch (SyncException e) {
            return fail(result, state, e);
        }
        state = transition(state, SyncState.TRACKING_READY);

        boolean firstRun = trackingStore.isFirstRun();
        result.firstRun(firstRun);
        state = transition(state, firstRun ? SyncState.FIRST_RUN : SyncState.RESYNC);
        if (firstRun) {
            log.info("First run: performing full synchronization.");
        } else {
            log.info("Tracking records found: performing full resynchronization.");
        }

        for (String table : verified) {
            log.info("Setting up synchronization for table {}", table);
        }
        SyncBatchResult batch = synchronizer.syncTables(verified);
        result.batchResult(batch);
        if (!batch.isSuccess()) {
            return fail(result, state, batch.getError());
        }
        transition(state, SyncState.SYNCED);
        logSummary(batch);
        return result.state(SyncState.SYNCED).build();
    }

    private SyncState transition(SyncState from, SyncState to) {
        log.info("Bootstrap state: {} -> {}", from, to);
        return to;
    }

    private BootstrapResult fail(BootstrapResult.BootstrapResultBuilder result, SyncState from,
            SyncException error) {
        transition(from, SyncState.FAILED);
        log.error("Bootstrap failed: {}", error.getMessage(), error);
        return result.state(SyncState.FAILED).error(error).build();
    }

    private void logSummary(SyncBatchResult batch) {
        log.info("Synchronized tables: {}", batch.getCopiedTables());
        if (batch.hasSkippedTables()) {
            log.warn("Skipped tables: {}", batch.getSkippedTables().keySet());
        }
        try {
            for (SyncTrackingRecord record : trackingStore.findAll()) {
                log.info("  {} last synced at {} (UTC)", record.getTableName(),
                        record.getLastSyncedAt());
            }
        } catch (TrackingReadException e) {
            log.warn(e.getMessage(), e);
        }
    }
}
