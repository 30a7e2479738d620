package io.github.yok.clickload.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal condition of the command-line front door.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error through SLF4J, including the stack trace when a cause is given.</li>
 * <li>Writes a one-line, human-readable cause to {@code System.err}.</li>
 * <li>Does not end the JVM; {@link io.github.yok.clickload.Main} turns the failure into a non-zero
 * exit code.</li>
 * <li>Tests may switch the current thread to "throw instead" mode.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_ENABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@link #fatal} throw an {@link IllegalStateException} on the current thread.
     */
    public static void throwOnFatalForCurrentThread() {
        THROW_ENABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting for the current thread.
     */
    public static void restoreForCurrentThread() {
        THROW_ENABLED.remove();
    }

    /**
     * Reports a fatal error with its root cause.
     *
     * @param message what failed
     * @param cause root cause
     */
    public static void fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + ": " + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports a fatal error without an underlying exception.
     *
     * @param message what failed
     */
    public static void fatal(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
