package io.github.yok.tablemailer.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Central place where fatal errors and aborted job runs are reported.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>{@code errorAndExit} is for errors that end the process (an invalid configuration, a failed
 * {@code --once} run). The error is logged, a one-line summary goes to {@code System.err} and the
 * JVM exits with {@link #EXIT_FAILURE}.</li>
 * <li>{@code logAbort} is for a scheduled run cut short by a connect, export, build or delivery
 * failure. The process keeps running; the next trigger is the next chance to recover.</li>
 * <li>Tests switch {@code errorAndExit} to throw {@link IllegalStateException} instead of exiting
 * through a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /** Process exit status used for fatal errors. */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restores exiting on the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal error with its cause and terminates the process.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{} ({})", message, ExceptionUtils.getRootCauseMessage(cause));
        log.debug("Fatal error cause", cause);
        exit(message, cause);
    }

    /**
     * Reports a fatal error without a cause and terminates the process.
     *
     * @param message message to log
     */
    public static void errorAndExit(String message) {
        log.error(message);
        exit(message, null);
    }

    /**
     * Reports that the current job run was aborted. Remaining work in the run is skipped by the
     * caller.
     *
     * @param stage pipeline stage that failed (e.g. {@code "export"})
     * @param message what was being processed
     * @param cause root cause
     */
    public static void logAbort(String stage, String message, Throwable cause) {
        log.error("Job run aborted at {}: {} ({})", stage, message,
                ExceptionUtils.getRootCauseMessage(cause));
        log.debug("Abort cause", cause);
    }

    private static void exit(String message, Throwable cause) {
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message);
        System.exit(EXIT_FAILURE);
    }
}
