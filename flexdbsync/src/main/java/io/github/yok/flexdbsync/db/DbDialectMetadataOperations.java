package io.github.yok.flexdbsync.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Metadata operations for each database dialect.
 */
public interface DbDialectMetadataOperations {

    /**
     * Table types passed to {@link DatabaseMetaData#getTables} and to DBUnit when listing user
     * tables.
     *
     * @return table types
     */
    default String[] getTableTypes() {
        return new String[] {"TABLE"};
    }

    /**
     * Catalog argument passed to {@link DatabaseMetaData} lookups for a resolved schema.
     *
     * @param schema resolved schema
     * @return catalog, or {@code null} to not narrow by catalog
     */
    default String metadataCatalog(String schema) {
        return null;
    }

    /**
     * Schema argument passed to {@link DatabaseMetaData} lookups for a resolved schema.
     *
     * @param schema resolved schema
     * @return schema pattern, or {@code null} to not narrow by schema
     */
    default String metadataSchema(String schema) {
        return schema;
    }

    /**
     * Finds a table by name, ignoring case, and returns the name as spelled by the catalog.
     *
     * @param connection JDBC connection
     * @param schema schema name
     * @param table requested table name
     * @return catalog spelling of the table name, or empty when the table does not exist
     * @throws SQLException if metadata retrieval fails
     */
    default Optional<String> findTableName(Connection connection, String schema, String table)
            throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String exact = null;
        String caseInsensitive = null;
        try (ResultSet rs = meta.getTables(metadataCatalog(schema),
                metadataSchema(schema), "%", getTableTypes())) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (name.equals(table)) {
                    exact = name;
                } else if (caseInsensitive == null && name.equalsIgnoreCase(table)) {
                    caseInsensitive = name;
                }
            }
        }
        return Optional.ofNullable(exact != null ? exact : caseInsensitive);
    }

    /**
     * Retrieves ordered primary-key column names.
     *
     * @param connection JDBC connection
     * @param schema schema name
     * @param table table name as spelled by the catalog
     * @return PK columns ordered by KEY_SEQ (empty if none)
     * @throws SQLException if metadata retrieval fails
     */
    default List<String> getPrimaryKeyColumns(Connection connection, String schema, String table)
            throws SQLException {
        TreeMap<Short, String> bySeq = new TreeMap<>();
        try (ResultSet rs = connection.getMetaData()
                .getPrimaryKeys(metadataCatalog(schema), metadataSchema(schema), table)) {
            while (rs.next()) {
                bySeq.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return List.copyOf(bySeq.values());
    }
}
