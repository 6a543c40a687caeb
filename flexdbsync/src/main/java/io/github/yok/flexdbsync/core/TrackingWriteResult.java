package io.github.yok.flexdbsync.core;

import lombok.Value;

/**
 * Outcome of one tracking upsert.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TrackingWriteResult {

    // Synchronized table name
    String tableName;

    // Failure, or null when the record was written
    TrackingWriteException error;

    /**
     * Creates a successful result.
     *
     * @param tableName synchronized table name
     * @return result
     */
    public static TrackingWriteResult success(String tableName) {
        return new TrackingWriteResult(tableName, null);
    }

    /**
     * Creates a failed result.
     *
     * @param error failure
     * @return result
     */
    public static TrackingWriteResult failure(TrackingWriteException error) {
        return new TrackingWriteResult(error.getTableName(), error);
    }

    /**
     * Returns whether the record was written.
     *
     * @return {@code true} on success
     */
    public boolean isSuccess() {
        return error == null;
    }
}
