package io.github.yok.flexdbsync.core;

import lombok.Getter;

/**
 * Raised when the last-sync timestamp of a table cannot be written.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TrackingWriteException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Synchronized table whose record could not be written
    private final String tableName;

    /**
     * Creates an exception.
     *
     * @param tableName synchronized table name
     * @param cause underlying failure
     */
    public TrackingWriteException(String tableName, Throwable cause) {
        super("Failed to record sync time for table " + tableName, cause);
        this.tableName = tableName;
    }
}
