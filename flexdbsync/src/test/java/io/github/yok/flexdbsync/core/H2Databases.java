package io.github.yok.flexdbsync.core;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.db.DbUnitConfigFactory;
import io.github.yok.flexdbsync.db.h2.H2DialectHandler;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * In-memory H2 databases for synchronization tests.
 */
final class H2Databases {

    static final Instant FIXED_NOW = Instant.parse("2024-05-01T12:34:56Z");

    private H2Databases() {}

    static ConnectionConfig.Entry newDatabase(String id) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry(id);
        entry.setUrl("jdbc:h2:mem:" + id + "_" + UUID.randomUUID().toString().replace("-", "")
                + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE");
        entry.setUser("sa");
        entry.setPassword("");
        entry.setDriverClass("org.h2.Driver");
        return entry;
    }

    static SyncContext context(ConnectionConfig.Entry source, ConnectionConfig.Entry destination) {
        return context(source, destination, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    static SyncContext context(ConnectionConfig.Entry source, ConnectionConfig.Entry destination,
            Clock clock) {
        H2DialectHandler dialect = new H2DialectHandler(new DbUnitConfigFactory());
        return SyncContext.builder().source(source).destination(destination).sourceDialect(dialect)
                .destinationDialect(dialect).trackingTable("sync_tracking").clock(clock).build();
    }

    static Connection open(ConnectionConfig.Entry entry) throws SQLException {
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }

    static void execute(ConnectionConfig.Entry entry, String... sqls) throws SQLException {
        try (Connection conn = open(entry); Statement st = conn.createStatement()) {
            for (String sql : sqls) {
                st.execute(sql);
            }
        }
    }

    /**
     * Returns each row as {@code col1|col2|...}.
     */
    static List<String> rows(ConnectionConfig.Entry entry, String sql) throws SQLException {
        List<String> rows = new ArrayList<>();
        try (Connection conn = open(entry);
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            int count = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                StringBuilder row = new StringBuilder();
                for (int i = 1; i <= count; i++) {
                    if (i > 1) {
                        row.append('|');
                    }
                    row.append(rs.getString(i));
                }
                rows.add(row.toString());
            }
        }
        return rows;
    }

    static boolean tableExists(ConnectionConfig.Entry entry, String table) throws SQLException {
        try (Connection conn = open(entry);
                ResultSet rs = conn.getMetaData().getTables(null, "PUBLIC", table,
                        new String[] {"TABLE", "BASE TABLE"})) {
            return rs.next();
        }
    }
}
