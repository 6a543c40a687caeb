package io.github.yok.flexdbsync.db;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import java.sql.Connection;
import java.sql.SQLException;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Returns the database product this handler serves.
     *
     * @return database product
     */
    DataTypeFactoryMode getMode();

    /**
     * Applies dialect-specific initialization to a freshly opened JDBC connection.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Resolves the schema that holds the synchronized tables for the given connection.
     *
     * @param connection JDBC connection
     * @return schema name handled by the dialect
     * @throws SQLException if the current schema cannot be read
     */
    String resolveSchema(Connection connection) throws SQLException;

    /**
     * Creates a DBUnit connection configured for the dialect. The returned connection wraps the
     * given JDBC connection; closing the JDBC connection remains the caller's responsibility.
     *
     * @param connection JDBC connection
     * @param schema resolved schema name
     * @return initialized DBUnit connection
     * @throws DatabaseUnitException if initialization fails
     */
    DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException;

    /**
     * Returns DBUnit datatype factory for the dialect.
     *
     * @return DBUnit datatype factory
     */
    IDataTypeFactory getDataTypeFactory();
}
