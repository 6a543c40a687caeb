package io.github.yok.flexdbsync.db.h2;

import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.AbstractDbDialectHandler;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.Types;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * Dialect handler for H2 (embedded and in-memory databases).
 *
 * <p>
 * H2 2.x reports ordinary tables with the type {@code BASE TABLE}; both spellings are listed so
 * metadata lookups work across H2 versions.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler extends AbstractDbDialectHandler {

    // Largest explicit character length H2 accepts
    private static final int MAX_LENGTH = 1_000_000_000;

    private final IDataTypeFactory dataTypeFactory = new H2DataTypeFactory();

    /**
     * Creates an H2 handler.
     *
     * @param configFactory DBUnit configuration factory
     */
    public H2DialectHandler(DbUnitConfigFactory configFactory) {
        super(configFactory);
    }

    @Override
    public DataTypeFactoryMode getMode() {
        return DataTypeFactoryMode.H2;
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

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public String[] getTableTypes() {
        return new String[] {"TABLE", "BASE TABLE"};
    }

    @Override
    public String renderColumnType(ColumnDescriptor column) {
        switch (column.getJdbcType()) {
            case Types.CHAR:
            case Types.NCHAR:
                return hasSize(column, MAX_LENGTH) ? "CHAR(" + column.getSize() + ")" : "CHAR";
            case Types.VARCHAR:
            case Types.NVARCHAR:
            case Types.LONGVARCHAR:
            case Types.LONGNVARCHAR:
                return hasSize(column, MAX_LENGTH) ? "VARCHAR(" + column.getSize() + ")"
                        : "VARCHAR";
            case Types.CLOB:
            case Types.NCLOB:
                return "CLOB";
            case Types.NUMERIC:
            case Types.DECIMAL:
                return renderNumeric("NUMERIC", column, 100_000);
            case Types.TIME_WITH_TIMEZONE:
                return "TIME WITH TIME ZONE";
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return "TIMESTAMP WITH TIME ZONE";
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
                return hasSize(column, MAX_LENGTH) ? "VARBINARY(" + column.getSize() + ")"
                        : "VARBINARY";
            case Types.BLOB:
                return "BLOB";
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
