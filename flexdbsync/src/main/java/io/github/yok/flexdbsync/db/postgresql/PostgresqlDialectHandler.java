package io.github.yok.flexdbsync.db.postgresql;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.AbstractDbDialectHandler;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Dialect handler for PostgreSQL.
 *
 * <p>
 * Unbounded character columns ({@code text}, or {@code varchar} without a length) are recreated as
 * {@code TEXT}. Types without a JDBC mapping ({@code uuid}, {@code jsonb}, {@code inet}, ...) keep
 * their native name, which is valid as long as the destination is PostgreSQL as well.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler extends AbstractDbDialectHandler {

    // Largest explicit varchar length PostgreSQL accepts
    private static final int MAX_VARCHAR_LENGTH = 10_485_760;

    private final IDataTypeFactory dataTypeFactory = new PostgresqlDataTypeFactory();

    /**
     * Creates a PostgreSQL handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    public PostgresqlDialectHandler(DbUnitConfigFactory configFactory) {
        super(configFactory);
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return DataTypeFactoryMode.POSTGRESQL;
    }

    /**
     * Pins the session time zone to UTC so tracking timestamps are written as UTC.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if the statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET TIME ZONE 'UTC'");
        }
    }

    /**
     * Uses the current schema, falling back to {@code public}.
     *
     * @param connection JDBC connection
     * @return schema name
     * @throws SQLException if the schema cannot be read
     */
    @Override
    public String resolveSchema(Connection connection) throws SQLException {
        String schema = connection.getSchema();
        return (schema == null || schema.isBlank()) ? "public" : schema;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public String renderColumnType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.CHAR:
            case Types.NCHAR:
                return hasSize(column, MAX_VARCHAR_LENGTH) ? "CHAR(" + column.getSize() + ")"
                        : "CHAR";
            case Types.VARCHAR:
            case Types.NVARCHAR:
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
                if ("text".equalsIgnoreCase(column.getTypeName())
                        || !hasSize(column, MAX_VARCHAR_LENGTH)) {
                    return "TEXT";
                }
                return "VARCHAR(" + column.getSize() + ")";
            case Types.CLOB:
            case Types.NCLOB:
                return "TEXT";
            case Types.NUMERIC:
            case Types.DECIMAL:
                return renderNumeric("NUMERIC", column, 1000);
            case Types.TIME_WITH_TIMEZONE:
                return "TIMETZ";
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "TIMESTAMPTZ";
            case Types.TIMESTAMP:
                return "timestamptz".equalsIgnoreCase(column.getTypeName()) ? "TIMESTAMPTZ"
                        : "TIMESTAMP";
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return "BYTEA";
            case Types.OTHER:
            case Types.ARRAY:
            case Types.STRUCT:
                return column.getTypeName();
            default:
                return renderStandardType(column);
        }
    }

    @Override
    public String getIdentityColumnDefinition() {
        return "BIGINT GENERATED BY DEFAULT AS IDENTITY";
    }

    @Override
    public String getTimestampTypeName() {
        return "TIMESTAMP";
    }
}
