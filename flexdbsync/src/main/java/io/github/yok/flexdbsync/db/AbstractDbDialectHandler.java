package io.github.yok.flexdbsync.db;

import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;

/**
 * Base class of the dialect handlers.
 *
 * <p>
 * Holds the DBUnit configuration shared by every product and the type-mapping fallback used when
 * a dialect has no specific rule for a JDBC type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractDbDialectHandler implements DbDialectHandler {

    // Applies common settings to DBUnit's DatabaseConfig
    private final DbUnitConfigFactory configFactory;

    /**
     * Creates a handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    protected AbstractDbDialectHandler(DbUnitConfigFactory configFactory) {
        this.configFactory = configFactory;
    }

    /**
     * Uses the connection's current schema.
     *
     * @param connection JDBC connection
     * @return current schema
     * @throws SQLException if the schema cannot be read
     */
    @Override
    public String resolveSchema(Connection connection) throws SQLException {
        return connection.getSchema();
    }

    /**
     * Creates a DBUnit connection and applies the shared configuration.
     *
     * @param connection JDBC connection
     * @param schema resolved schema name
     * @return DBUnit connection
     * @throws DatabaseUnitException if DBUnit rejects the connection
     */
    @Override
    public DatabaseConnection createDbUnitConnection(Connection connection, String schema)
            throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(connection, schema);
        configFactory.configure(dbConn.getConfig(), getDataTypeFactory(), quoteIdentifier("?"),
                getTableTypes());
        log.debug("DBUnit connection created: mode={}, schema={}", getMode(), schema);
        return dbConn;
    }

    /**
     * Double-quote identifiers (SQL standard).
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier + "\"";
    }

    /**
     * Returns whether the column reports a usable length/precision.
     *
     * @param column column
     * @param max largest value the target type accepts
     * @return {@code true} when {@code 0 < size <= max}
     */
    protected static boolean hasSize(ColumnDescriptor column, int max) {
        return column.getSize() > 0 && column.getSize() <= max;
    }

    /**
     * Renders {@code NUMERIC(p,s)} or the bare type when the precision is not usable.
     *
     * @param typeName numeric type name of the dialect
     * @param column column
     * @param maxPrecision largest precision the dialect accepts
     * @return rendered type
     */
    protected static String renderNumeric(String typeName, ColumnDescriptor column,
            int maxPrecision) {
        if (!hasSize(column, maxPrecision)) {
            return typeName;
        }
        return typeName + "(" + column.getSize() + "," + Math.max(column.getDecimalDigits(), 0)
                + ")";
    }

    /**
     * Fallback mapping for JDBC types no dialect overrides.
     *
     * @param column column
     * @return SQL standard type, or the source type name when unknown
     */
    protected String renderStandardType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.BIT:
            case Types.BOOLEAN:
                return "BOOLEAN";
            case Types.TINYINT:
            case Types.SMALLINT:
                return "SMALLINT";
            case Types.INTEGER:
                return "INTEGER";
            case Types.BIGINT:
                return "BIGINT";
            case Types.REAL:
                return "REAL";
            case Types.FLOAT:
            case Types.DOUBLE:
                return "DOUBLE PRECISION";
            case Types.DATE:
                return "DATE";
            case Types.TIME:
                return "TIME";
            case Types.TIMESTAMP:
                return getTimestampTypeName();
            default:
                log.warn("No type mapping for column {} (jdbcType={}, typeName={}); "
                        + "using source type name", column.getName(), column.getJdbcType(),
                        column.getTypeName());
                return column.getTypeName();
        }
    }
}
