package io.github.yok.clickload.util;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Diagnostics} implementation that forwards every message to an SLF4J {@link Logger}.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Slf4jDiagnostics implements Diagnostics {

    private final Logger logger;

    /**
     * Wraps an existing logger.
     *
     * @param logger target logger
     */
    public Slf4jDiagnostics(Logger logger) {
        this.logger = Preconditions.checkNotNull(logger, "logger must not be null");
    }

    /**
     * Creates a sink that logs under the category of the given component class.
     *
     * @param component component class
     * @return diagnostics sink
     */
    public static Slf4jDiagnostics forClass(Class<?> component) {
        return new Slf4jDiagnostics(LoggerFactory.getLogger(component));
    }

    @Override
    public void info(String format, Object... args) {
        logger.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }

    @Override
    public void error(String format, Object... args) {
        logger.error(format, args);
    }
}
