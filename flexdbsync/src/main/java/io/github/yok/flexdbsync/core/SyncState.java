package io.github.yok.flexdbsync.core;

/**
 * States a bootstrap run passes through.
 *
 * <pre>
 * INIT → SCHEMA_CHECKED → TRACKING_READY → (FIRST_RUN | RESYNC) → SYNCED | FAILED
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SyncState {
    // Nothing checked yet
    INIT,
    // Requested tables verified against the source
    SCHEMA_CHECKED,
    // Tracking table exists in the destination
    TRACKING_READY,
    // Tracking table was empty or unreadable
    FIRST_RUN,
    // Tracking table already had records
    RESYNC,
    // Batch committed
    SYNCED,
    // Run aborted
    FAILED
}
