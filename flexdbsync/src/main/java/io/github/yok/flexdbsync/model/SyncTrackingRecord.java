package io.github.yok.flexdbsync.model;

import java.time.LocalDateTime;
import lombok.Value;

/**
 * One row of the tracking table: the last time a table was synchronized.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SyncTrackingRecord {

    // Synchronized table name (unique key)
    String tableName;

    // Wall-clock time of the last successful sync, in UTC
    LocalDateTime lastSyncedAt;
}
