package com.meltwater.rxqueue.util;

import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Logger which outputs a message followed by key/value pairs.
 *
 * <p>
 * Example usage:
 * <code><pre>
 * Logger log = new Logger(AmqpQueue.class);
 * log.infoWithParams("Queue declared", "queue", name, "messageCount", 12);
 * </pre></code>
 * Which would output something like this (depending on the slf4j backend configuration):
 * <pre>com.meltwater.rxqueue.AmqpQueue INFO: Queue declared [ queue="jobs", messageCount=12 ]</pre>
 * </p>
 *
 * <p>Values are rendered with toString(). Boxed primitives and null are rendered unquoted.</p>
 */
public class Logger {

    private enum Level {TRACE, DEBUG, INFO, WARN, ERROR}

    private static final List<Class<?>> UNQUOTED_TYPES = Arrays.asList(
            Boolean.class, Byte.class, Character.class, Double.class,
            Float.class, Integer.class, Long.class, Short.class);

    private final org.slf4j.Logger logger;

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public String getName() {
        return logger.getName();
    }

    public void traceWithParams(String message, Object... params) {
        log(Level.TRACE, message, null, params);
    }

    public void debugWithParams(String message, Object... params) {
        log(Level.DEBUG, message, null, params);
    }

    public void infoWithParams(String message, Object... params) {
        log(Level.INFO, message, null, params);
    }

    public void warnWithParams(String message, Object... params) {
        log(Level.WARN, message, null, params);
    }

    public void warnWithParams(String message, Throwable t, Object... params) {
        log(Level.WARN, message, t, params);
    }

    public void errorWithParams(String message, Object... params) {
        log(Level.ERROR, message, null, params);
    }

    public void errorWithParams(String message, Throwable t, Object... params) {
        log(Level.ERROR, message, t, params);
    }

    private void log(Level level, String message, Throwable t, Object[] params) {
        if (!isEnabled(level)) {
            return;
        }
        String line;
        try {
            line = buildLogMessage(message, params);
        } catch (IllegalArgumentException e) {
            logger.error("Failed to assemble log message for logger {}! Params must be declared in pairs! message={}, params={}",
                    getName(), message, Arrays.toString(params));
            line = message;
        }
        switch (level) {
            case TRACE: logger.trace(line, t); break;
            case DEBUG: logger.debug(line, t); break;
            case INFO:  logger.info(line, t); break;
            case WARN:  logger.warn(line, t); break;
            case ERROR: logger.error(line, t); break;
        }
    }

    private boolean isEnabled(Level level) {
        switch (level) {
            case TRACE: return logger.isTraceEnabled();
            case DEBUG: return logger.isDebugEnabled();
            case INFO:  return logger.isInfoEnabled();
            case WARN:  return logger.isWarnEnabled();
            default:    return logger.isErrorEnabled();
        }
    }

    protected String buildLogMessage(String message, Object[] params) {
        if (params.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Params must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        if (params.length == 0) {
            return message;
        }
        final StringBuilder sb = new StringBuilder(message).append(" [ ");
        for (int i = 0; i < params.length; i += 2) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(params[i]).append('=');
            Object value = params[i + 1];
            if (value == null || UNQUOTED_TYPES.contains(value.getClass())) {
                sb.append(value);
            } else {
                sb.append('"').append(value).append('"');
            }
        }
        return sb.append(" ]").toString();
    }
}
