package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.db.DbDialectHandler;
import io.github.yok.flexdbsync.model.TableDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes sure a source table exists in the destination.
 *
 * <p>
 * A missing destination table is created from the source structure (column names and order,
 * nullability, primary key) with types rendered by the destination dialect. An existing table is
 * never altered. It is rejected when it lacks a source column, since the rows could not be
 * inserted; extra destination columns only produce a warning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaMirror {

    private final SyncContext context;
    private final SchemaIntrospector introspector;

    /**
     * Creates a mirror.
     *
     * @param context sync context
     * @param introspector metadata reader
     */
    public SchemaMirror(SyncContext context, SchemaIntrospector introspector) {
        this.context = context;
        this.introspector = introspector;
    }

    /**
     * Ensures a table exists in the destination.
     *
     * <p>
     * DDL is executed in the current transaction mode of {@code destination}; callers pass an
     * auto-commit connection.
     * </p>
     *
     * @param source source connection
     * @param destination destination connection
     * @param tableName requested table name
     * @return the table pair
     * @throws SchemaIntrospectionException if the table does not exist in the source
     * @throws SchemaMirrorException if the destination cannot be inspected, the existing table
     *         lacks source columns or the DDL fails
     */
    public MirroredTable ensureTableMirrored(Connection source, Connection destination,
            String tableName) {
        TableDescriptor sourceTable =
                introspector.introspect(source, context.getSourceDialect(), tableName);
        DbDialectHandler dialect = context.getDestinationDialect();
        String destId = context.getDestination().getId();

        Optional<String> existing;
        try {
            String schema = dialect.resolveSchema(destination);
            existing = dialect.findTableName(destination, schema, sourceTable.getName());
        } catch (SQLException e) {
            throw new SchemaMirrorException(tableName,
                    "Failed to look up table " + tableName + " in destination", e);
        }

        if (existing.isPresent()) {
            TableDescriptor destTable =
                    introspector.introspect(destination, dialect, existing.get());
            checkColumns(destId, tableName, sourceTable, destTable);
            return new MirroredTable(tableName, sourceTable, existing.get(), false);
        }

        String ddl = dialect.buildCreateTableSql(sourceTable);
        log.debug("[{}] DDL: {}", destId, ddl);
        try (Statement st = destination.createStatement()) {
            st.execute(ddl);
        } catch (SQLException e) {
            throw new SchemaMirrorException(tableName,
                    "Failed to create table " + sourceTable.getName() + " in destination", e);
        }
        log.info("[{}] Created table {} ({} columns, pk={})", destId, sourceTable.getName(),
                sourceTable.getColumns().size(), sourceTable.getPrimaryKeyColumns());
        return new MirroredTable(tableName, sourceTable, sourceTable.getName(), true);
    }

    private void checkColumns(String destId, String tableName, TableDescriptor sourceTable,
            TableDescriptor destTable) {
        Set<String> sourceCols = sourceTable.getNormalizedColumnNames();
        Set<String> destCols = destTable.getNormalizedColumnNames();
        if (sourceCols.equals(destCols)) {
            return;
        }
        Set<String> onlySource = new LinkedHashSet<>(sourceCols);
        onlySource.removeAll(destCols);
        if (!onlySource.isEmpty()) {
            throw new SchemaMirrorException(tableName, "Table " + destTable.getName()
                    + " in destination lacks source columns " + onlySource);
        }
        Set<String> onlyDest = new LinkedHashSet<>(destCols);
        onlyDest.removeAll(sourceCols);
        log.warn("[{}] Table {} has columns not present in source: {}", destId,
                destTable.getName(), onlyDest);
    }
}
