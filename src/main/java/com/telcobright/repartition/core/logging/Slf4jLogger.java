package com.telcobright.repartition.core.logging;

import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Default logger: delegates to SLF4J. Structured events put their type into the
 * MDC under {@code event} for the duration of the call so appenders can route
 * on it.
 */
public class Slf4jLogger implements Logger {

    private final org.slf4j.Logger delegate;

    public Slf4jLogger(Class<?> owner) {
        this(LoggerFactory.getLogger(owner));
    }

    public Slf4jLogger(String name) {
        this(LoggerFactory.getLogger(name));
    }

    Slf4jLogger(org.slf4j.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public boolean isLevelEnabled(Level level) {
        switch (level) {
            case TRACE: return delegate.isTraceEnabled();
            case DEBUG: return delegate.isDebugEnabled();
            case INFO: return delegate.isInfoEnabled();
            case WARN: return delegate.isWarnEnabled();
            default: return delegate.isErrorEnabled();
        }
    }

    @Override
    public void log(Level level, String message, Throwable throwable) {
        switch (level) {
            case TRACE:
                delegate.trace(message, throwable);
                break;
            case DEBUG:
                delegate.debug(message, throwable);
                break;
            case INFO:
                delegate.info(message, throwable);
                break;
            case WARN:
                delegate.warn(message, throwable);
                break;
            default:
                delegate.error(message, throwable);
        }
    }

    @Override
    public void logEvent(Level level, String eventType, String message, Map<String, Object> context) {
        if (!isLevelEnabled(level)) {
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable("event", eventType)) {
            log(level, render(eventType, message, context));
        }
    }

    /**
     * {@code message [event=TYPE, key=value, ...]}
     */
    static String render(String eventType, String message, Map<String, Object> context) {
        StringBuilder sb = new StringBuilder(message).append(" [event=").append(eventType);
        if (context != null) {
            context.forEach((key, value) -> sb.append(", ").append(key).append("=").append(value));
        }
        return sb.append("]").toString();
    }
}
