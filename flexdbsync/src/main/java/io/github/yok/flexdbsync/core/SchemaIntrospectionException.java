package io.github.yok.flexdbsync.core;

import lombok.Getter;

/**
 * Raised when a table cannot be read from database metadata, typically because it does not exist
 * in the source.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SchemaIntrospectionException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Requested table name
    private final String tableName;

    /**
     * Creates an exception for a table.
     *
     * @param tableName requested table name
     * @param message detail message
     */
    public SchemaIntrospectionException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }

    /**
     * Creates an exception for a table with a cause.
     *
     * @param tableName requested table name
     * @param message detail message
     * @param cause underlying failure
     */
    public SchemaIntrospectionException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }
}
