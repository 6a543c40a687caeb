package io.github.yok.flexdbsync.db.sqlserver;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.AbstractDbDialectHandler;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;

/**
 * Dialect handler for Microsoft SQL Server.
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlServerDialectHandler extends AbstractDbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new MsSqlDataTypeFactory();

    /**
     * Creates a SQL Server handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    public SqlServerDialectHandler(DbUnitConfigFactory configFactory) {
        super(configFactory);
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return DataTypeFactoryMode.SQLSERVER;
    }

    /**
     * No session settings are needed.
     *
     * @param connection JDBC connection
     */
    @Override
    public void prepareConnection(Connection connection) {
        // nothing to prepare
    }

    /**
     * Uses the current schema, falling back to {@code dbo}.
     *
     * @param connection JDBC connection
     * @return schema name
     * @throws SQLException if the schema cannot be read
     */
    @Override
    public String resolveSchema(Connection connection) throws SQLException {
        String schema = connection.getSchema();
        return (schema == null || schema.isBlank()) ? "dbo" : schema;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "[" + identifier + "]";
    }

    @Override
    public String renderColumnType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.BIT:
            case Types.BOOLEAN:
                return "BIT";
            case Types.TINYINT:
                return "TINYINT";
            case Types.FLOAT:
            case Types.DOUBLE:
                return "FLOAT";
            case Types.NUMERIC:
            case Types.DECIMAL:
                return renderNumeric("DECIMAL", column, 38);
            case Types.CHAR:
                return hasSize(column, 8000) ? "CHAR(" + column.getSize() + ")" : "CHAR(1)";
            case Types.NCHAR:
                return hasSize(column, 4000) ? "NCHAR(" + column.getSize() + ")" : "NCHAR(1)";
            case Types.VARCHAR:
                return hasSize(column, 8000) ? "VARCHAR(" + column.getSize() + ")"
                        : "VARCHAR(MAX)";
            case Types.NVARCHAR:
                return hasSize(column, 4000) ? "NVARCHAR(" + column.getSize() + ")"
                        : "NVARCHAR(MAX)";
            case Types.LONGVARCHAR:
            case Types.CLOB:
                return "VARCHAR(MAX)";
            case Types.LONGNVARCHAR:
            case Types.NCLOB:
                return "NVARCHAR(MAX)";
            case Types.TIMESTAMP:
                return "DATETIME2";
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "DATETIMEOFFSET";
            case Types.BINARY:
            case Types.VARBINARY:
                return hasSize(column, 8000) ? "VARBINARY(" + column.getSize() + ")"
                        : "VARBINARY(MAX)";
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return "VARBINARY(MAX)";
            default:
                return renderStandardType(column);
        }
    }

    @Override
    public String getIdentityColumnDefinition() {
        return "BIGINT IDENTITY(1,1)";
    }

    @Override
    public String getTimestampTypeName() {
        return "DATETIME2";
    }
}
