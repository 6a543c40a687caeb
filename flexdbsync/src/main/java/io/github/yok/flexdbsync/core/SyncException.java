package io.github.yok.flexdbsync.core;

/**
 * Root of the unchecked exceptions raised while synchronizing tables.
 *
 * @author Yasuharu.Okawauchi
 */
public class SyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SyncException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
