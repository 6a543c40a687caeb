package io.github.yok.flexdbsync.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Raised when the read/delete/insert sequence of a batch fails. The whole batch is rolled back.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SyncBatchException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Table being processed when the failure occurred; null when no table was started
    private final String tableName;

    // Every table of the batch, in batch order
    private final List<String> batchTables;

    /**
     * Creates an exception.
     *
     * @param tableName table being processed, or {@code null}
     * @param batchTables tables of the batch
     * @param cause underlying failure
     */
    public SyncBatchException(String tableName, List<String> batchTables, Throwable cause) {
        super(buildMessage(tableName, batchTables, cause), cause);
        this.tableName = tableName;
        this.batchTables = ImmutableList.copyOf(batchTables);
    }

    private static String buildMessage(String tableName, List<String> batchTables,
            Throwable cause) {
        String where = tableName == null ? "before any table" : "at table " + tableName;
        return "Sync batch failed " + where + " (batch=" + batchTables + "): "
                + cause.getMessage();
    }
}
