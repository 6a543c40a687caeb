package io.github.yok.flexdbsync.core;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of {@link BootstrapController#run(List)} and the process exit code derived from it.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class BootstrapResult {

    /**
     * Every requested table was present and synchronized.
     */
    public static final int EXIT_OK = 0;

    /**
     * The run failed.
     */
    public static final int EXIT_FAILED = 1;

    /**
     * The batch committed, but some requested tables were missing or skipped.
     */
    public static final int EXIT_INCOMPLETE = 2;

    // Terminal state (SYNCED or FAILED)
    SyncState state;

    // Whether the tracking table was empty or unreadable
    boolean firstRun;

    // Requested tables absent from the source
    @Singular
    List<String> missingTables;

    // Synchronizer outcome; null when the run failed before the batch
    SyncBatchResult batchResult;

    // Failure that ended the run, or null
    SyncException error;

    /**
     * Maps this result to a process exit code.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_INCOMPLETE} or {@link #EXIT_FAILED}
     */
    public int getExitCode() {
        if (state != SyncState.SYNCED) {
            return EXIT_FAILED;
        }
        if (!missingTables.isEmpty()
                || (batchResult != null && batchResult.hasSkippedTables())) {
            return EXIT_INCOMPLETE;
        }
        return EXIT_OK;
    }
}
