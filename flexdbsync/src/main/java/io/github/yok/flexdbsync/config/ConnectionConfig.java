package io.github.yok.flexdbsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the two JDBC endpoints of a synchronization: the primary (source)
 * database and the secondary (destination) database.
 *
 * <pre>
 * connections:
 *   primary:
 *     url: ${PRIMARY_DB_URL:jdbc:postgresql://localhost:5432/primary_db}
 *     user: ${PRIMARY_DB_USER:user}
 *     password: ${PRIMARY_DB_PASSWORD:password}
 *   secondary:
 *     url: ${SECONDARY_DB_URL:jdbc:postgresql://localhost:5432/secondary_db}
 *     user: ${SECONDARY_DB_USER:user}
 *     password: ${SECONDARY_DB_PASSWORD:password}
 * </pre>
 *
 * <p>
 * The defaults in {@code application.yml} point at placeholder credentials and exist only so the
 * application starts on a developer machine. They must never be used in production.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "connections")
@Data
public class ConnectionConfig {

    /**
     * Placeholder user name shipped in the default configuration.
     */
    public static final String PLACEHOLDER_USER = "user";

    /**
     * Placeholder password shipped in the default configuration.
     */
    public static final String PLACEHOLDER_PASSWORD = "password";

    /**
     * Source database (read-only during synchronization).
     */
    private Entry primary = new Entry("primary");

    /**
     * Destination database (overwritten during synchronization).
     */
    private Entry secondary = new Entry("secondary");

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID used in log lines (e.g., "primary")
        private String id;
        // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/primary_db)
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
        private String driverClass;

        /**
         * Creates an empty entry (used by configuration binding).
         */
        public Entry() {}

        /**
         * Creates an entry with the given logical ID.
         *
         * @param id logical ID
         */
        public Entry(String id) {
            this.id = id;
        }

        /**
         * Returns whether this entry still carries the placeholder credentials of the default
         * configuration.
         *
         * @return {@code true} when both user and password are the shipped placeholders
         */
        public boolean hasPlaceholderCredentials() {
            return PLACEHOLDER_USER.equals(user) && PLACEHOLDER_PASSWORD.equals(password);
        }
    }
}
