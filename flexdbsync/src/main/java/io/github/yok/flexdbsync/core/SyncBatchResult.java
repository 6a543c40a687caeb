package io.github.yok.flexdbsync.core;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of {@link TableSynchronizer#syncTables(List)}.
 *
 * <p>
 * Row counts and tracking results describe the work done inside the batch transaction. When
 * {@link #getError()} is set the transaction was rolled back and nothing of it is visible in the
 * destination.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class SyncBatchResult {

    // Tables passed to the synchronizer, in order
    @Singular
    List<String> requestedTables;

    // Copied tables and the number of rows inserted into each
    @Singular
    Map<String, Integer> copiedTables;

    // Tables excluded before the data phase and why
    @Singular
    Map<String, SyncException> skippedTables;

    // Tracking upserts performed inside the batch
    @Singular
    List<TrackingWriteResult> trackingResults;

    // Batch failure, or null
    SyncBatchException error;

    // Whether the destination transaction was committed
    boolean committed;

    /**
     * Returns whether the batch completed without error.
     *
     * @return {@code true} when no batch error occurred
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns whether some requested tables were excluded from the batch.
     *
     * @return {@code true} if at least one table was skipped
     */
    public boolean hasSkippedTables() {
        return !skippedTables.isEmpty();
    }
}
