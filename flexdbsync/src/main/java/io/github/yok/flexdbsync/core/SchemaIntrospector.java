package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.db.DbDialectHandler;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import io.github.yok.flexdbsync.model.TableDescriptor;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads table structure from JDBC metadata.
 *
 * <p>
 * Table names are matched case-insensitively; the returned descriptor keeps the spelling of the
 * catalog. Columns are ordered by {@code ORDINAL_POSITION} and primary-key columns by
 * {@code KEY_SEQ}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaIntrospector {

    /**
     * Reads the structure of a table.
     *
     * @param connection JDBC connection
     * @param dialect dialect of the connection
     * @param tableName requested table name
     * @return table descriptor
     * @throws SchemaIntrospectionException if the table does not exist or metadata cannot be read
     */
    public TableDescriptor introspect(Connection connection, DbDialectHandler dialect,
            String tableName) {
        try {
            String schema = dialect.resolveSchema(connection);
            Optional<String> found = dialect.findTableName(connection, schema, tableName);
            if (found.isEmpty()) {
                throw new SchemaIntrospectionException(tableName,
                        "Table not found: " + tableName + " (schema=" + schema + ")");
            }
            String actualName = found.get();
            List<ColumnDescriptor> columns = readColumns(connection, dialect, schema, actualName);
            if (columns.isEmpty()) {
                throw new SchemaIntrospectionException(tableName,
                        "No columns reported for table " + actualName + " (schema=" + schema
                                + ")");
            }
            List<String> pk = dialect.getPrimaryKeyColumns(connection, schema, actualName);
            log.debug("Introspected {}.{}: columns={}, pk={}", schema, actualName,
                    columns.size(), pk);
            return new TableDescriptor(actualName, columns, pk);
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(tableName,
                    "Failed to read metadata of table " + tableName, e);
        }
    }

    /**
     * Returns whether a table exists.
     *
     * @param connection JDBC connection
     * @param dialect dialect of the connection
     * @param tableName requested table name
     * @return {@code true} if the table exists (case-insensitive)
     * @throws SchemaIntrospectionException if metadata cannot be read
     */
    public boolean exists(Connection connection, DbDialectHandler dialect, String tableName) {
        try {
            String schema = dialect.resolveSchema(connection);
            return dialect.findTableName(connection, schema, tableName).isPresent();
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(tableName,
                    "Failed to look up table " + tableName, e);
        }
    }

    /**
     * Reads the columns of a table. {@code getColumns} takes a pattern, so rows of other tables
     * matched through {@code _} or {@code %} are filtered out.
     */
    private List<ColumnDescriptor> readColumns(Connection connection, DbDialectHandler dialect,
            String schema, String tableName) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(dialect.metadataCatalog(schema),
                dialect.metadataSchema(schema), tableName, "%")) {
            while (rs.next()) {
                if (!tableName.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                columns.add(ColumnDescriptor.builder().name(rs.getString("COLUMN_NAME"))
                        .jdbcType(rs.getInt("DATA_TYPE")).typeName(rs.getString("TYPE_NAME"))
                        .size(rs.getInt("COLUMN_SIZE")).decimalDigits(rs.getInt("DECIMAL_DIGITS"))
                        .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                        .ordinalPosition(rs.getInt("ORDINAL_POSITION")).build());
            }
        }
        columns.sort(Comparator.comparingInt(ColumnDescriptor::getOrdinalPosition));
        return columns;
    }
}
