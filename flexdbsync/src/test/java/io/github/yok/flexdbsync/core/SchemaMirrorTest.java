package io.github.yok.flexdbsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;
import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.db.h2.H2DialectHandler;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import io.github.yok.flexdbsync.model.TableDescriptor;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaMirrorTest {

    private ConnectionConfig.Entry source;
    private ConnectionConfig.Entry destination;
    private SchemaIntrospector introspector;

    @BeforeEach
    void setup() throws Exception {
        source = H2Databases.newDatabase("mirror_src");
        destination = H2Databases.newDatabase("mirror_dst");
        introspector = new SchemaIntrospector();
        H2Databases.execute(source, "CREATE TABLE example_table (id INTEGER NOT NULL, "
                + "name VARCHAR(100), created_at TIMESTAMP, PRIMARY KEY (id))");
    }

    @Test
    void ensureTableMirrored_正常ケース_宛先に存在しないテーブルを指定する_同一構造のテーブルが作成されること()
            throws Exception {
        SchemaMirror mirror = new SchemaMirror(H2Databases.context(source, destination),
                introspector);

        MirroredTable result;
        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            result = mirror.ensureTableMirrored(src, dst, "example_table");
        }

        assertTrue(result.isCreated());
        assertEquals("example_table", result.getRequestedName());
        assertEquals("example_table", result.getDestinationName());
        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            H2DialectHandler dialect = new H2DialectHandler(new DbUnitConfigFactory());
            TableDescriptor expected = introspector.introspect(src, dialect, "example_table");
            TableDescriptor actual = introspector.introspect(dst, dialect, "example_table");
            assertEquals(expected.getColumnNames(), actual.getColumnNames());
            assertEquals(List.of("id"), actual.getPrimaryKeyColumns());
            for (int i = 0; i < expected.getColumns().size(); i++) {
                ColumnDescriptor e = expected.getColumns().get(i);
                ColumnDescriptor a = actual.getColumns().get(i);
                assertEquals(e.getJdbcType(), a.getJdbcType(), e.getName());
                assertEquals(e.isNullable(), a.isNullable(), e.getName());
            }
            assertEquals(100, actual.getColumns().get(1).getSize());
        }
        assertEquals(List.of(), H2Databases.rows(destination, "SELECT * FROM example_table"));
    }

    @Test
    void ensureTableMirrored_正常ケース_宛先に既存テーブルがある_作成されず既存名が返ること() throws Exception {
        H2Databases.execute(destination,
                "CREATE TABLE EXAMPLE_TABLE (id INTEGER NOT NULL, name VARCHAR(100), "
                        + "created_at TIMESTAMP, extra_col INTEGER)",
                "INSERT INTO EXAMPLE_TABLE VALUES (9, 'keep', NULL, 1)");
        SchemaMirror mirror = new SchemaMirror(H2Databases.context(source, destination),
                introspector);

        MirroredTable result;
        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            result = mirror.ensureTableMirrored(src, dst, "example_table");
        }

        assertFalse(result.isCreated());
        assertEquals("EXAMPLE_TABLE", result.getDestinationName());
        assertEquals(List.of("9|keep|null|1"),
                H2Databases.rows(destination, "SELECT * FROM EXAMPLE_TABLE"));
    }

    @Test
    void ensureTableMirrored_異常ケース_既存テーブルにソースの列が不足している_SchemaMirrorExceptionが送出されること()
            throws Exception {
        H2Databases.execute(destination,
                "CREATE TABLE example_table (id INTEGER NOT NULL, name VARCHAR(100))",
                "INSERT INTO example_table VALUES (9, 'keep')");
        SchemaMirror mirror = new SchemaMirror(H2Databases.context(source, destination),
                introspector);

        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            SchemaMirrorException ex = assertThrows(SchemaMirrorException.class,
                    () -> mirror.ensureTableMirrored(src, dst, "example_table"));
            assertEquals("example_table", ex.getTableName());
            assertTrue(ex.getMessage().contains("CREATED_AT"));
        }
        assertEquals(List.of("9|keep"),
                H2Databases.rows(destination, "SELECT * FROM example_table"));
    }

    @Test
    void ensureTableMirrored_異常ケース_ソースに存在しないテーブルを指定する_SchemaIntrospectionExceptionが送出されること()
            throws Exception {
        SchemaMirror mirror = new SchemaMirror(H2Databases.context(source, destination),
                introspector);

        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            SchemaIntrospectionException ex = assertThrows(SchemaIntrospectionException.class,
                    () -> mirror.ensureTableMirrored(src, dst, "missing_table"));
            assertEquals("missing_table", ex.getTableName());
        }
        assertFalse(H2Databases.tableExists(destination, "missing_table"));
    }

    @Test
    void ensureTableMirrored_異常ケース_DDLが失敗する_SchemaMirrorExceptionが送出されること() throws Exception {
        H2DialectHandler dialect = new H2DialectHandler(new DbUnitConfigFactory());
        H2DialectHandler brokenDestination = spy(dialect);
        doReturn("CREATE TABLE example_table (id NO_SUCH_TYPE)").when(brokenDestination)
                .buildCreateTableSql(any());
        SyncContext context = SyncContext.builder().source(source).destination(destination)
                .sourceDialect(dialect).destinationDialect(brokenDestination)
                .trackingTable("sync_tracking").clock(Clock.systemUTC()).build();
        SchemaMirror mirror = new SchemaMirror(context, introspector);

        try (Connection src = H2Databases.open(source);
                Connection dst = H2Databases.open(destination)) {
            SchemaMirrorException ex = assertThrows(SchemaMirrorException.class,
                    () -> mirror.ensureTableMirrored(src, dst, "example_table"));
            assertEquals("example_table", ex.getTableName());
            assertTrue(ex.getCause() instanceof SQLException);
        }
    }
}
