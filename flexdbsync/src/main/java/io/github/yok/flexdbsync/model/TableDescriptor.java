package io.github.yok.flexdbsync.model;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Structure of a table introspected from a live connection: ordered columns and primary key.
 *
 * <p>
 * Descriptors are never declared statically. They are read from the source connection and used
 * to create the matching destination table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableDescriptor {

    // Table name as spelled by the catalog
    String name;

    // Columns ordered by ordinal position
    List<ColumnDescriptor> columns;

    // Primary-key columns ordered by key sequence (empty if none)
    List<String> primaryKeyColumns;

    /**
     * Creates a descriptor with defensive copies of the column and key lists.
     *
     * @param name table name
     * @param columns ordered columns
     * @param primaryKeyColumns ordered primary-key column names
     */
    public TableDescriptor(String name, List<ColumnDescriptor> columns,
            List<String> primaryKeyColumns) {
        this.name = name;
        this.columns = ImmutableList.copyOf(columns);
        this.primaryKeyColumns = ImmutableList.copyOf(primaryKeyColumns);
    }

    /**
     * Returns the column names in ordinal order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
    }

    /**
     * Returns the column names upper-cased, for case-insensitive structure comparison.
     *
     * @return normalized column name set
     */
    public Set<String> getNormalizedColumnNames() {
        return columns.stream().map(c -> c.getName().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
