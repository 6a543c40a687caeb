package io.github.yok.flexdbsync.core;

import lombok.Getter;

/**
 * Raised when a source table cannot be mirrored into the destination: the DDL is rejected or an
 * existing destination table cannot hold the source rows.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SchemaMirrorException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Table that could not be mirrored
    private final String tableName;

    /**
     * Creates an exception.
     *
     * @param tableName table that could not be mirrored
     * @param message detail message
     * @param cause underlying failure
     */
    public SchemaMirrorException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }

    /**
     * Creates an exception without an underlying failure.
     *
     * @param tableName table that could not be mirrored
     * @param message detail message
     */
    public SchemaMirrorException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }
}
