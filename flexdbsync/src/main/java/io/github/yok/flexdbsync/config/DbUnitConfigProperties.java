package io.github.yok.flexdbsync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} for both sides of a sync.
 *
 * <ul>
 * <li>{@code dbunit.config.allow-empty-fields}: Whether empty strings are written as-is</li>
 * <li>{@code dbunit.config.batched-statements}: Whether inserts are sent as JDBC batches</li>
 * <li>{@code dbunit.config.batch-size}: Statements per JDBC batch</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Rows are copied verbatim, so empty strings read from the source must be accepted.
     */
    private boolean allowEmptyFields = true;

    /**
     * Rows are inserted one statement at a time unless enabled.
     */
    private boolean batchedStatements = false;

    /**
     * Number of statements per JDBC batch when batching is enabled.
     */
    private int batchSize = 100;
}
