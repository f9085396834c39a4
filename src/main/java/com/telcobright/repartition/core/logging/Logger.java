package com.telcobright.repartition.core.logging;

import java.util.Map;

/**
 * Where engine components write their diagnostics. The engine logs through
 * SLF4J by default ({@link Slf4jLogger}); a host that routes its logs
 * elsewhere passes its own implementation to the engine builder.
 *
 * Gate workers and the archive scheduler log from their own threads, so
 * implementations are called concurrently.
 */
public interface Logger {

    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    boolean isLevelEnabled(Level level);

    /**
     * @param throwable may be null
     */
    void log(Level level, String message, Throwable throwable);

    /**
     * Log a migration or archiving milestone with its identifiers attached.
     *
     * @param eventType upper-case event name, e.g. "CUTOVER_COMPLETED" or "SLICE_EXCHANGED"
     * @param context run id, table names and similar values
     */
    void logEvent(Level level, String eventType, String message, Map<String, Object> context);

    default void log(Level level, String message) {
        log(level, message, null);
    }

    default boolean isDebugEnabled() {
        return isLevelEnabled(Level.DEBUG);
    }

    default void trace(String message) {
        log(Level.TRACE, message);
    }

    default void debug(String message) {
        log(Level.DEBUG, message);
    }

    default void info(String message) {
        log(Level.INFO, message);
    }

    default void warn(String message) {
        log(Level.WARN, message);
    }

    default void warn(String message, Throwable throwable) {
        log(Level.WARN, message, throwable);
    }

    default void error(String message) {
        log(Level.ERROR, message);
    }

    default void error(String message, Throwable throwable) {
        log(Level.ERROR, message, throwable);
    }
}
