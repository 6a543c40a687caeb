package io.github.yok.flexdbsync.db.mysql;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.AbstractDbDialectHandler;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;

/**
 * Dialect handler for MySQL.
 *
 * <p>
 * MySQL exposes databases as JDBC catalogs, not schemas, so the schema resolves to the current
 * catalog.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler extends AbstractDbDialectHandler {

    // Largest varchar length kept as VARCHAR (utf8mb4 row-size limit)
    private static final int MAX_VARCHAR_LENGTH = 16_383;

    private final IDataTypeFactory dataTypeFactory = new MySqlDataTypeFactory();

    /**
     * Creates a MySQL handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    public MySqlDialectHandler(DbUnitConfigFactory configFactory) {
        super(configFactory);
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return DataTypeFactoryMode.MYSQL;
    }

    /**
     * Sets UTC time zone and utf8mb4 so values round-trip unchanged.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if any statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES utf8mb4");
        }
    }

    /**
     * Uses the current catalog (database name).
     *
     * @param connection JDBC connection
     * @return database name
     * @throws SQLException if the catalog cannot be read
     */
    @Override
    public String resolveSchema(Connection connection) throws SQLException {
        return connection.getCatalog();
    }

    @Override
    public String metadataCatalog(String schema) {
        return schema;
    }

    @Override
    public String metadataSchema(String schema) {
        return null;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier + "`";
    }

    @Override
    public String renderColumnType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.BIT:
            case Types.BOOLEAN:
                return "TINYINT(1)";
            case Types.TINYINT:
                return "TINYINT";
            case Types.DOUBLE:
            case Types.FLOAT:
                return "DOUBLE";
            case Types.CHAR:
            case Types.NCHAR:
                return hasSize(column, 255) ? "CHAR(" + column.getSize() + ")" : "VARCHAR(255)";
            case Types.VARCHAR:
            case Types.NVARCHAR:
                return hasSize(column, MAX_VARCHAR_LENGTH) ? "VARCHAR(" + column.getSize() + ")"
                        : "LONGTEXT";
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                return "LONGTEXT";
            case Types.NUMERIC:
            case Types.DECIMAL:
                return renderNumeric("DECIMAL", column, 65);
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "DATETIME(6)";
            case Types.BINARY:
            case Types.VARBINARY:
                return hasSize(column, 65_535) ? "VARBINARY(" + column.getSize() + ")"
                        : "LONGBLOB";
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return "LONGBLOB";
            default:
                return renderStandardType(column);
        }
    }

    @Override
    public String getIdentityColumnDefinition() {
        return "BIGINT AUTO_INCREMENT";
    }

    @Override
    public String getTimestampTypeName() {
        return "DATETIME(6)";
    }
}
