package io.github.yok.flexdbsync.db;

import io.github.yok.flexdbsync.model.ColumnDescriptor;
import io.github.yok.flexdbsync.model.TableDescriptor;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SQL grammar and DDL operations for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Renders the native column type used when a source column is recreated in this database.
     *
     * @param column source column
     * @return native type, including length/precision where applicable
     */
    String renderColumnType(ColumnDescriptor column);

    /**
     * Returns the column definition of an auto-generated surrogate key (without PRIMARY KEY).
     *
     * @return identity column definition
     */
    String getIdentityColumnDefinition();

    /**
     * Returns the native type of a timestamp without time zone.
     *
     * @return timestamp type
     */
    String getTimestampTypeName();

    /**
     * Returns the native type of a bounded character column.
     *
     * @param length maximum length
     * @return varchar type
     */
    default String getVarcharTypeName(int length) {
        return "VARCHAR(" + length + ")";
    }

    /**
     * Builds a {@code CREATE TABLE} statement that recreates the given table in this database.
     *
     * @param table table descriptor introspected from the source
     * @return CREATE TABLE statement
     */
    default String buildCreateTableSql(TableDescriptor table) {
        StringBuilder ddl = new StringBuilder();
        ddl.append("CREATE TABLE ").append(quoteIdentifier(table.getName())).append(" (");
        List<ColumnDescriptor> columns = table.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            ColumnDescriptor col = columns.get(i);
            if (i > 0) {
                ddl.append(", ");
            }
            ddl.append(quoteIdentifier(col.getName())).append(' ').append(renderColumnType(col));
            if (!col.isNullable()) {
                ddl.append(" NOT NULL");
            }
        }
        if (!table.getPrimaryKeyColumns().isEmpty()) {
            ddl.append(", PRIMARY KEY (");
            ddl.append(table.getPrimaryKeyColumns().stream().map(this::quoteIdentifier)
                    .collect(Collectors.joining(", ")));
            ddl.append(')');
        }
        ddl.append(')');
        return ddl.toString();
    }

    /**
     * Builds the {@code CREATE TABLE} statement of the tracking table.
     *
     * @param trackingTable tracking table name
     * @return CREATE TABLE statement
     */
    default String buildCreateTrackingTableSql(String trackingTable) {
        return "CREATE TABLE " + quoteIdentifier(trackingTable) + " ("
                + quoteIdentifier("id") + " " + getIdentityColumnDefinition() + " PRIMARY KEY, "
                + quoteIdentifier("table_name") + " " + getVarcharTypeName(255)
                + " NOT NULL UNIQUE, "
                + quoteIdentifier("last_synced_at") + " " + getTimestampTypeName() + " NOT NULL)";
    }

    /**
     * Returns row count of table.
     *
     * @param connection JDBC connection
     * @param table table name
     * @return row count
     * @throws SQLException if SQL execution fails
     */
    default int countRows(Connection connection, String table) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + quoteIdentifier(table);
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
