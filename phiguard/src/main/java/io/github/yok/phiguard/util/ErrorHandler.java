package io.github.yok.phiguard.util;

import io.github.yok.phiguard.exception.PhiGuardException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Intended for the CLI where a fail-fast handling is desired.
 * </p>
 *
 * <ul>
 * <li>Logs the error (with stack trace) using SLF4J. Messages are masked first.</li>
 * <li>Writes a concise message to {@code System.err}.</li>
 * <li>Returns the exit code for the failure; it does not terminate the JVM by itself.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    /**
     * Exit code for failures that are not a {@link PhiGuardException}.
     */
    public static final int GENERIC_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of ending the process" for the current thread (useful for
     * tests).
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
     * Maps a failure to the process exit code.
     *
     * @param cause failure
     * @return exit code of the {@link PhiGuardException} kind, otherwise {@link #GENERIC_FAILURE}
     */
    public static int exitCodeFor(Throwable cause) {
        if (cause instanceof PhiGuardException) {
            return ((PhiGuardException) cause).getKind().getExitCode();
        }
        return GENERIC_FAILURE;
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     * @return exit code for {@code cause}
     */
    public static int errorAndExit(String message, Throwable cause) {
        String masked = MaskingLogUtil.maskSensitive(message);
        log.error("{}\n{}", masked,
                MaskingLogUtil.maskSensitive(ExceptionUtils.getStackTrace(cause)));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(masked, cause);
        }
        String label = cause instanceof PhiGuardException
                ? ((PhiGuardException) cause).getKind().getLabel() : "ERROR";
        System.err.println(label + ": " + masked + "\n"
                + MaskingLogUtil.maskSensitive(cause.getMessage()));
        return exitCodeFor(cause);
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * <p>
     * If "exit is disabled" for the current thread, this method throws an exception instead.
     * </p>
     *
     * @param message message to log
     * @return {@link #GENERIC_FAILURE}
     */
    public static int errorAndExit(String message) {
        String masked = MaskingLogUtil.maskSensitive(message);
        log.error(masked);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(masked);
        }
        System.err.println("ERROR: " + masked);
        return GENERIC_FAILURE;
    }
}
