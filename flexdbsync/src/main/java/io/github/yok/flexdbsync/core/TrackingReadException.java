package io.github.yok.flexdbsync.core;

import lombok.Getter;

/**
 * Raised when the tracking table cannot be read.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TrackingReadException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Tracking table name
    private final String trackingTable;

    /**
     * Creates an exception.
     *
     * @param trackingTable tracking table name
     * @param cause underlying failure
     */
    public TrackingReadException(String trackingTable, Throwable cause) {
        super("Failed to read tracking table " + trackingTable, cause);
        this.trackingTable = trackingTable;
    }
}
