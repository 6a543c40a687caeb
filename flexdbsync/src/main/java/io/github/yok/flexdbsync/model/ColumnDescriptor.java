package io.github.yok.flexdbsync.model;

import java.sql.DatabaseMetaData;
import lombok.Builder;
import lombok.Value;

/**
 * Structure of one column as reported by {@link DatabaseMetaData#getColumns}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ColumnDescriptor {

    // Column name as spelled by the catalog
    String name;

    // java.sql.Types code (DATA_TYPE)
    int jdbcType;

    // Product-specific type name (TYPE_NAME)
    String typeName;

    // COLUMN_SIZE: length for character types, precision for numeric types
    int size;

    // DECIMAL_DIGITS: scale for numeric types, fractional seconds for temporal types
    int decimalDigits;

    // false only when the catalog reports columnNoNulls
    boolean nullable;

    // 1-based ORDINAL_POSITION
    int ordinalPosition;
}
