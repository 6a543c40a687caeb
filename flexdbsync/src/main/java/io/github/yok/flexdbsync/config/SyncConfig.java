package io.github.yok.flexdbsync.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings related to synchronization runs.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code sync.tables}: Ordered list of table names copied on each run</li>
 * <li>{@code sync.tracking-table}: Name of the destination table that records the last sync
 * time of each table</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "sync")
@Getter
@Setter
@NoArgsConstructor
public class SyncConfig {

    /**
     * Default name of the tracking table.
     */
    public static final String DEFAULT_TRACKING_TABLE = "sync_tracking";

    /**
     * Table names to synchronize, in batch order.
     */
    private List<String> tables = ImmutableList.of("example_table", "another_table");

    /**
     * Name of the tracking table in the destination database.
     */
    private String trackingTable = DEFAULT_TRACKING_TABLE;
}
