package io.github.yok.flexdbsync.db.oracle;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.AbstractDbDialectHandler;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Locale;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;

/**
 * Dialect handler for Oracle Database (12c or later, for identity columns).
 *
 * @author Yasuharu.Okawauchi
 */
public class OracleDialectHandler extends AbstractDbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new Oracle10DataTypeFactory();

    /**
     * Creates an Oracle handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    public OracleDialectHandler(DbUnitConfigFactory configFactory) {
        super(configFactory);
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return DataTypeFactoryMode.ORACLE;
    }

    /**
     * Pins the session time zone to UTC.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if the statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("ALTER SESSION SET TIME_ZONE = 'UTC'");
        }
    }

    /**
     * Uses the current schema, which defaults to the user name in upper case.
     *
     * @param connection JDBC connection
     * @return schema name
     * @throws SQLException if the schema cannot be read
     */
    @Override
    public String resolveSchema(Connection connection) throws SQLException {
        String schema = connection.getSchema();
        if (schema == null || schema.isBlank()) {
            schema = connection.getMetaData().getUserName();
        }
        return schema.toUpperCase(Locale.ROOT);
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public String renderColumnType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.BIT:
            case Types.BOOLEAN:
                return "NUMBER(1)";
            case Types.TINYINT:
            case Types.SMALLINT:
                return "NUMBER(5)";
            case Types.INTEGER:
                return "NUMBER(10)";
            case Types.BIGINT:
                return "NUMBER(19)";
            case Types.REAL:
                return "BINARY_FLOAT";
            case Types.FLOAT:
            case Types.DOUBLE:
                return "BINARY_DOUBLE";
            case Types.NUMERIC:
            case Types.DECIMAL:
                return renderNumeric("NUMBER", column, 38);
            case Types.CHAR:
                return hasSize(column, 2000) ? "CHAR(" + column.getSize() + ")" : "CHAR(1)";
            case Types.NCHAR:
                return hasSize(column, 1000) ? "NCHAR(" + column.getSize() + ")" : "NCHAR(1)";
            case Types.VARCHAR:
                return hasSize(column, 4000) ? getVarcharTypeName(column.getSize()) : "CLOB";
            case Types.NVARCHAR:
                return hasSize(column, 2000) ? "NVARCHAR2(" + column.getSize() + ")" : "NCLOB";
            case Types.LONGVARCHAR:
            case Types.CLOB:
                return "CLOB";
            case Types.LONGNVARCHAR:
            case Types.NCLOB:
                return "NCLOB";
            case Types.DATE:
                return "DATE";
            case Types.TIME:
            case Types.TIMESTAMP:
                return "TIMESTAMP";
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "TIMESTAMP WITH TIME ZONE";
            case Types.BINARY:
            case Types.VARBINARY:
                return hasSize(column, 2000) ? "RAW(" + column.getSize() + ")" : "BLOB";
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return "BLOB";
            default:
                return renderStandardType(column);
        }
    }

    @Override
    public String getVarcharTypeName(int length) {
        return "VARCHAR2(" + length + ")";
    }

    @Override
    public String getIdentityColumnDefinition() {
        return "NUMBER(19) GENERATED BY DEFAULT AS IDENTITY";
    }

    @Override
    public String getTimestampTypeName() {
        return "TIMESTAMP";
    }
}
