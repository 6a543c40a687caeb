package io.github.yok.flexdbsync.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal error: full stack trace to the log, one concise line to
 * {@code System.err}.
 *
 * <p>
 * It never terminates the JVM. The process exit code is decided by the caller (see
 * {@code Main#getExitCode()}). In tests, the current thread can be switched to throwing an
 * {@link IllegalStateException} instead, so the failure path can be asserted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_ON_FATAL =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@link #fatal(String, Throwable)} throw on the current thread (for tests).
     */
    public static void throwOnFatalForCurrentThread() {
        THROW_ON_FATAL.set(Boolean.TRUE);
    }

    /**
     * Restores normal behavior for the current thread.
     */
    public static void restoreForCurrentThread() {
        THROW_ON_FATAL.remove();
    }

    /**
     * Logs the message with the stack trace of {@code cause} at error level and prints
     * {@code ERROR: <message> (<root cause>)} to {@code System.err}.
     *
     * @param message message to log
     * @param cause failure
     * @throws IllegalStateException when throwing is enabled for the current thread
     */
    public static void fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ON_FATAL.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + " (" + ExceptionUtils.getRootCauseMessage(cause)
                + ")");
    }
}
