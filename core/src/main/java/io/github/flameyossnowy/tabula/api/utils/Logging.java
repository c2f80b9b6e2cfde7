package io.github.flameyossnowy.tabula.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Static logging facade used across Tabula.
 *
 * <p>{@link #ENABLED} gates informational output, {@link #DEEP} additionally enables the
 * verbose mapping and DDL traces. Warnings and errors are always forwarded.</p>
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("Tabula");

    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private Logging() {
        throw new AssertionError("No instances");
    }

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) LOGGER.info(message.get());
    }

    public static void info(String message) {
        if (ENABLED) LOGGER.info(message);
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isInfoEnabled()) LOGGER.info("[deep] {}", message.get());
    }

    public static void deepInfo(String message) {
        if (ENABLED && DEEP) LOGGER.info("[deep] {}", message);
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }
}
