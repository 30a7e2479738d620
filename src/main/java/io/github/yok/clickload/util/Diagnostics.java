package io.github.yok.clickload.util;

/**
 * Diagnostics sink handed to each ingestion component at construction time.
 *
 * <p>
 * Messages use SLF4J-style {@code {}} placeholders. A trailing {@link Throwable} argument is
 * treated as the cause, as SLF4J does.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see Slf4jDiagnostics
 */
public interface Diagnostics {

    /**
     * Emits an informational message.
     *
     * @param format message pattern
     * @param args pattern arguments
     */
    void info(String format, Object... args);

    /**
     * Emits a warning. Used for recoverable conditions such as a cell that could not be coerced.
     *
     * @param format message pattern
     * @param args pattern arguments
     */
    void warn(String format, Object... args);

    /**
     * Emits an error. Used when a run is about to end in failure.
     *
     * @param format message pattern
     * @param args pattern arguments
     */
    void error(String format, Object... args);
}
