package io.github.yok.flexdbsync.db.oracle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.model.ColumnDescriptor;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Statement;
import java.sql.Types;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.junit.jupiter.api.Test;

class OracleDialectHandlerTest {

    private final OracleDialectHandler handler =
            new OracleDialectHandler(new DbUnitConfigFactory());

    private static ColumnDescriptor column(int jdbcType, String typeName, int size, int digits) {
        return ColumnDescriptor.builder().name("c").jdbcType(jdbcType).typeName(typeName)
                .size(size).decimalDigits(digits).nullable(true).ordinalPosition(1).build();
    }

    @Test
    void getMode_正常ケース_呼び出す_ORACLEが返ること() {
        assertEquals(DataTypeFactoryMode.ORACLE, handler.getMode());
        assertInstanceOf(Oracle10DataTypeFactory.class, handler.getDataTypeFactory());
    }

    @Test
    void prepareConnection_正常ケース_接続を指定する_セッションタイムゾーンがUTCになること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn);

        verify(st).execute("ALTER SESSION SET TIME_ZONE = 'UTC'");
    }

    @Test
    void resolveSchema_正常ケース_スキーマ未設定の接続を指定する_ユーザ名の大文字が返ること() throws Exception {
        Connection conn = mock(Connection.class);
        DatabaseMetaData meta = mock(DatabaseMetaData.class);
        when(conn.getSchema()).thenReturn(null);
        when(conn.getMetaData()).thenReturn(meta);
        when(meta.getUserName()).thenReturn("app_user");

        assertEquals("APP_USER", handler.resolveSchema(conn));
    }

    @Test
    void renderColumnType_正常ケース_各JDBC型を指定する_Oracleの型が返ること() {
        assertEquals("NUMBER(10)", handler.renderColumnType(column(Types.INTEGER, "int4", 10, 0)));
        assertEquals("VARCHAR2(100)",
                handler.renderColumnType(column(Types.VARCHAR, "varchar", 100, 0)));
        assertEquals("CLOB",
                handler.renderColumnType(column(Types.VARCHAR, "text", 2147483647, 0)));
        assertEquals("NUMBER(12,2)",
                handler.renderColumnType(column(Types.NUMERIC, "numeric", 12, 2)));
        assertEquals("TIMESTAMP",
                handler.renderColumnType(column(Types.TIMESTAMP, "timestamp", 29, 6)));
        assertEquals("NUMBER(1)", handler.renderColumnType(column(Types.BOOLEAN, "bool", 1, 0)));
        assertEquals("RAW(16)", handler.renderColumnType(column(Types.BINARY, "RAW", 16, 0)));
    }

    @Test
    void getIdentityColumnDefinition_正常ケース_呼び出す_Oracleの識別列定義が返ること() {
        assertEquals("NUMBER(19) GENERATED BY DEFAULT AS IDENTITY",
                handler.getIdentityColumnDefinition());
        assertEquals("VARCHAR2(255)", handler.getVarcharTypeName(255));
    }
}
