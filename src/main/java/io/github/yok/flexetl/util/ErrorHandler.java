package io.github.yok.flexetl.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Used at the CLI boundary only. The ETL core propagates its errors; this class turns them into
 * one readable line for the operator.
 * </p>
 *
 * <ul>
 * <li>Logs the error with the full stack trace using SLF4J.</li>
 * <li>Writes {@code ERROR: <message>} and the root cause message to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread (useful for tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and cause, then prints a concise report to {@code System.err}.
     *
     * @param message message to log
     * @param cause failure that ended the run
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
