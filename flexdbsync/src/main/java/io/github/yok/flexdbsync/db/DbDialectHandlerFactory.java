package io.github.yok.flexdbsync.db;

import io.github.yok.flexdbsync.config.ConnectionConfig;
import io.github.yok.flexdbsync.config.DataTypeFactoryMode;
import io.github.yok.flexdbsync.db.h2.H2DialectHandler;
import io.github.yok.flexdbsync.db.mysql.MySqlDialectHandler;
import io.github.yok.flexdbsync.db.oracle.OracleDialectHandler;
import io.github.yok.flexdbsync.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.flexdbsync.db.sqlserver.SqlServerDialectHandler;
import io.github.yok.flexdbsync.util.MaskingLogUtil;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database type.
 *
 * <p>
 * The handler is resolved per {@link ConnectionConfig.Entry} using {@code driver-class} first and
 * the JDBC URL as a fallback. The source and the destination of a sync are resolved independently,
 * so the two sides may be different products.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DbDialectHandlerFactory {

    // Applies common settings to DBUnit's DatabaseConfig
    private final DbUnitConfigFactory configFactory;

    /**
     * Creates a {@link DbDialectHandler} based on the provided connection entry.
     *
     * @param entry connection information (URL, driver class, ID)
     * @return handler for the resolved product
     * @throws IllegalStateException if the product cannot be determined
     */
    public DbDialectHandler create(ConnectionConfig.Entry entry) {
        DataTypeFactoryMode mode;
        try {
            mode = resolveMode(entry);
        } catch (IllegalArgumentException e) {
            log.error("Invalid dialect resolution input", e);
            throw new IllegalStateException(e.getMessage(), e);
        }
        log.info("[{}] Dialect resolved: {}", entry.getId(), mode);
        switch (mode) {
            case POSTGRESQL:
                return new PostgresqlDialectHandler(configFactory);
            case MYSQL:
                return new MySqlDialectHandler(configFactory);
            case ORACLE:
                return new OracleDialectHandler(configFactory);
            case SQLSERVER:
                return new SqlServerDialectHandler(configFactory);
            case H2:
            default:
                return new H2DialectHandler(configFactory);
        }
    }

    /**
     * Resolves the database type for a connection entry.
     *
     * @param entry connection entry
     * @return resolved database type
     * @throws IllegalArgumentException if the database type cannot be determined
     */
    DataTypeFactoryMode resolveMode(ConnectionConfig.Entry entry) {
        DataTypeFactoryMode fromDriverClass = resolveModeFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }

        DataTypeFactoryMode fromUrl = resolveModeFromJdbcUrl(entry.getUrl());
        if (fromUrl != null) {
            return fromUrl;
        }

        String message = "Unsupported database dialect for connection id=" + entry.getId()
                + " (driver-class=" + entry.getDriverClass() + ", url="
                + MaskingLogUtil.maskJdbcUrl(entry.getUrl()) + ")";
        throw new IllegalArgumentException(message);
    }

    /**
     * Resolves the database type from a JDBC driver class name.
     *
     * @param driverClass JDBC driver class name
     * @return resolved database type, or {@code null} when not recognized
     */
    private DataTypeFactoryMode resolveModeFromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("org.postgresql.driver".equals(normalized)) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)) {
            return DataTypeFactoryMode.MYSQL;
        }
        if ("oracle.jdbc.oracledriver".equals(normalized)
                || "oracle.jdbc.driver.oracledriver".equals(normalized)) {
            return DataTypeFactoryMode.ORACLE;
        }
        if ("com.microsoft.sqlserver.jdbc.sqlserverdriver".equals(normalized)) {
            return DataTypeFactoryMode.SQLSERVER;
        }
        if ("org.h2.driver".equals(normalized)) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    /**
     * Resolves the database type from a JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return resolved database type, or {@code null} when not recognized
     */
    private DataTypeFactoryMode resolveModeFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DataTypeFactoryMode.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:mysql:") || normalized.startsWith("jdbc:mariadb:")) {
            return DataTypeFactoryMode.MYSQL;
        }
        if (normalized.startsWith("jdbc:oracle:")) {
            return DataTypeFactoryMode.ORACLE;
        }
        if (normalized.startsWith("jdbc:sqlserver:")) {
            return DataTypeFactoryMode.SQLSERVER;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DataTypeFactoryMode.H2;
        }
        return null;
    }

    /**
     * Normalizes a string for case-insensitive comparison.
     *
     * @param value source string
     * @return lower-case value, or {@code null} when input is {@code null} or blank
     */
    private String normalizeLower(String value) {
        if (value == null) {
            return null;
        }
        if (value.isBlank()) {
            return null;
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
