package io.github.yok.flexdbsync.db.mysql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import io.github.yok.flexdbsync.model.TableDescriptor;
import java.sql.Connection;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class MySqlDialectHandlerTest {

    private final MySqlDialectHandler handler = new MySqlDialectHandler(new DbUnitConfigFactory());

    private static ColumnDescriptor column(String name, int jdbcType, String typeName, int size,
            int digits) {
        return ColumnDescriptor.builder().name(name).jdbcType(jdbcType).typeName(typeName)
                .size(size).decimalDigits(digits).nullable(true).ordinalPosition(1).build();
    }

    @Test
    void quoteIdentifier_正常ケース_識別子を指定する_バッククォート付き文字列が返ること() {
        assertEquals("`A1`", handler.quoteIdentifier("A1"));
        assertEquals(DataTypeFactoryMode.MYSQL, handler.getMode());
    }

    @Test
    void prepareConnection_正常ケース_接続を指定する_UTCとutf8mb4が設定されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn);

        InOrder order = inOrder(st);
        order.verify(st).execute("SET time_zone = '+00:00'");
        order.verify(st).execute("SET NAMES utf8mb4");
    }

    @Test
    void resolveSchema_正常ケース_接続を指定する_カタログ名が返りメタデータはカタログで絞り込むこと()
            throws Exception {
        Connection conn = mock(Connection.class);
        when(conn.getCatalog()).thenReturn("app_db");

        String schema = handler.resolveSchema(conn);

        assertEquals("app_db", schema);
        assertEquals("app_db", handler.metadataCatalog(schema));
        assertNull(handler.metadataSchema(schema));
    }

    @Test
    void renderColumnType_正常ケース_各JDBC型を指定する_MySQLの型が返ること() {
        assertEquals("TINYINT(1)", handler.renderColumnType(column("c", Types.BIT, "BIT", 1, 0)));
        assertEquals("VARCHAR(255)",
                handler.renderColumnType(column("c", Types.VARCHAR, "VARCHAR", 255, 0)));
        assertEquals("LONGTEXT",
                handler.renderColumnType(column("c", Types.VARCHAR, "text", 2147483647, 0)));
        assertEquals("DECIMAL(10,2)",
                handler.renderColumnType(column("c", Types.DECIMAL, "DECIMAL", 10, 2)));
        assertEquals("DATETIME(6)",
                handler.renderColumnType(column("c", Types.TIMESTAMP, "timestamp", 29, 6)));
        assertEquals("LONGBLOB", handler.renderColumnType(column("c", Types.BLOB, "BLOB", 0, 0)));
        assertEquals("DOUBLE",
                handler.renderColumnType(column("c", Types.DOUBLE, "float8", 17, 0)));
    }

    @Test
    void buildCreateTrackingTableSql_正常ケース_テーブル名を指定する_MySQL形式のDDLが返ること() {
        assertEquals("CREATE TABLE `sync_tracking` (`id` BIGINT AUTO_INCREMENT PRIMARY KEY, "
                + "`table_name` VARCHAR(255) NOT NULL UNIQUE, "
                + "`last_synced_at` DATETIME(6) NOT NULL)",
                handler.buildCreateTrackingTableSql("sync_tracking"));
    }

    @Test
    void buildCreateTableSql_正常ケース_記述子を指定する_バッククォートでDDLが生成されること() {
        TableDescriptor table = new TableDescriptor("example_table",
                List.of(column("id", Types.INTEGER, "int4", 10, 0),
                        column("name", Types.VARCHAR, "text", 2147483647, 0)),
                List.of("id"));

        assertEquals("CREATE TABLE `example_table` (`id` INTEGER, `name` LONGTEXT, "
                + "PRIMARY KEY (`id`))", handler.buildCreateTableSql(table));
    }
}
