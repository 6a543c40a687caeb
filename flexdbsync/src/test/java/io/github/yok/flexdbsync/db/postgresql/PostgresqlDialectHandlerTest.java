package io.github.yok.flexdbsync.db.postgresql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.Statement;
import java.sql.Types;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class PostgresqlDialectHandlerTest {

    private final PostgresqlDialectHandler handler =
            new PostgresqlDialectHandler(new DbUnitConfigFactory());

    private static ColumnDescriptor column(int jdbcType, String typeName, int size, int digits) {
        return ColumnDescriptor.builder().name("c").jdbcType(jdbcType).typeName(typeName)
                .size(size).decimalDigits(digits).nullable(true).ordinalPosition(1).build();
    }

    @Test
    void getMode_正常ケース_呼び出す_POSTGRESQLが返ること() {
        assertEquals(DataTypeFactoryMode.POSTGRESQL, handler.getMode());
        assertInstanceOf(PostgresqlDataTypeFactory.class, handler.getDataTypeFactory());
    }

    @Test
    void prepareConnection_正常ケース_接続を指定する_タイムゾーンがUTCに設定されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn);

        verify(st).execute("SET TIME ZONE 'UTC'");
        verify(st).close();
    }

    @Test
    void resolveSchema_正常ケース_スキーマ未設定の接続を指定する_publicが返ること() throws Exception {
        Connection conn = mock(Connection.class);
        when(conn.getSchema()).thenReturn(null);
        assertEquals("public", handler.resolveSchema(conn));

        when(conn.getSchema()).thenReturn("sales");
        assertEquals("sales", handler.resolveSchema(conn));
    }

    @Test
    void renderColumnType_正常ケース_文字列型を指定する_textとvarcharが使い分けられること() {
        assertEquals("TEXT",
                handler.renderColumnType(column(Types.VARCHAR, "text", 2147483647, 0)));
        assertEquals("TEXT", handler.renderColumnType(column(Types.VARCHAR, "varchar", 0, 0)));
        assertEquals("VARCHAR(50)",
                handler.renderColumnType(column(Types.VARCHAR, "varchar", 50, 0)));
        assertEquals("CHAR(3)", handler.renderColumnType(column(Types.CHAR, "bpchar", 3, 0)));
    }

    @Test
    void renderColumnType_正常ケース_数値と日時とバイナリを指定する_PostgreSQLの型が返ること() {
        assertEquals("INTEGER", handler.renderColumnType(column(Types.INTEGER, "int4", 10, 0)));
        assertEquals("BIGINT", handler.renderColumnType(column(Types.BIGINT, "int8", 19, 0)));
        assertEquals("NUMERIC(12,3)",
                handler.renderColumnType(column(Types.NUMERIC, "numeric", 12, 3)));
        assertEquals("NUMERIC",
                handler.renderColumnType(column(Types.NUMERIC, "numeric", 131089, 0)));
        assertEquals("DOUBLE PRECISION",
                handler.renderColumnType(column(Types.DOUBLE, "float8", 17, 17)));
        assertEquals("BOOLEAN", handler.renderColumnType(column(Types.BIT, "bool", 1, 0)));
        assertEquals("TIMESTAMP",
                handler.renderColumnType(column(Types.TIMESTAMP, "timestamp", 29, 6)));
        assertEquals("TIMESTAMPTZ",
                handler.renderColumnType(column(Types.TIMESTAMP, "timestamptz", 35, 6)));
        assertEquals("BYTEA", handler.renderColumnType(column(Types.BINARY, "bytea", 0, 0)));
    }

    @Test
    void renderColumnType_正常ケース_JDBC対応のない型を指定する_型名がそのまま返ること() {
        assertEquals("uuid", handler.renderColumnType(column(Types.OTHER, "uuid", 0, 0)));
        assertEquals("jsonb", handler.renderColumnType(column(Types.OTHER, "jsonb", 0, 0)));
        assertEquals("_int4", handler.renderColumnType(column(Types.ARRAY, "_int4", 0, 0)));
    }

    @Test
    void getIdentityColumnDefinition_正常ケース_呼び出す_IDENTITY定義が返ること() {
        assertEquals("BIGINT GENERATED BY DEFAULT AS IDENTITY",
                handler.getIdentityColumnDefinition());
        assertEquals("\"sync_tracking\"", handler.quoteIdentifier("sync_tracking"));
    }
}
