package com.meltwater.rxamqp.util;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Logger class which provides a standardized way of outputting variables and their values.
 *
 * <p>
 * Example usage:
 * <code><pre>
 * Logger log = new Logger(Channel.class);
 * log.infoWithParams("Channel opened.", "channelNr", 1, "publisherConfirms", true);
 * </pre></code>
 * Which would output something like this (depending on you slf4j backend configuration):
 * <pre>com.meltwater.rxamqp.Channel INFO: Channel opened. [ channelNr=1, publisherConfirms=true ]</pre>
 * </p>
 *
 * <p>Values of list or array type are logged once per element with the same key. Variables must have a sane
 * toString() method.</p>
 */
public class Logger {

    private enum Level { TRACE, DEBUG, INFO, WARN, ERROR }

    private static final Set<Class<?>> UNQUOTED_TYPES = ImmutableSet.of(
            Boolean.class,
            Byte.class,
            Character.class,
            Double.class,
            Float.class,
            Integer.class,
            Long.class,
            Short.class,
            Void.class);

    private final org.slf4j.Logger logger;

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    public Logger(String loggerName) {
        this(LoggerFactory.getLogger(loggerName));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public String getName() {
        return logger.getName();
    }

    public void traceWithParams(String message, Object... arguments) {
        log(Level.TRACE, message, null, arguments);
    }

    public void debugWithParams(String message, Object... arguments) {
        log(Level.DEBUG, message, null, arguments);
    }

    public void debugWithParams(String message, Throwable t, Object... arguments) {
        log(Level.DEBUG, message, t, arguments);
    }

    public void infoWithParams(String message, Object... arguments) {
        log(Level.INFO, message, null, arguments);
    }

    public void warnWithParams(String message, Object... arguments) {
        log(Level.WARN, message, null, arguments);
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        log(Level.WARN, message, t, arguments);
    }

    public void errorWithParams(String message, Object... arguments) {
        log(Level.ERROR, message, null, arguments);
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        log(Level.ERROR, message, t, arguments);
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

    private void log(Level level, String message, Throwable t, Object[] arguments) {
        if (!isEnabled(level)) {
            return;
        }
        String text;
        try {
            text = buildLogMessage(message, arguments);
        } catch (IllegalArgumentException e) {
            logger.error("Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                    getName(), message, Arrays.toString(arguments));
            text = message;
        }
        switch (level) {
            case TRACE: logger.trace(text, t); break;
            case DEBUG: logger.debug(text, t); break;
            case INFO:  logger.info(text, t); break;
            case WARN:  logger.warn(text, t); break;
            default:    logger.error(text, t); break;
        }
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        if (arguments.length == 0) {
            return message;
        }
        List<String> pairs = new ArrayList<>();
        for (int i = 0; i < arguments.length; i += 2) {
            render(pairs, arguments[i], arguments[i + 1]);
        }
        return message + " [ " + Joiner.on(", ").join(pairs) + " ]";
    }

    private void render(List<String> pairs, Object key, Object value) {
        if (value instanceof Object[]) {
            value = Arrays.asList((Object[]) value);
        }
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                render(pairs, key, element);
            }
            return;
        }
        boolean unquoted = value == null || UNQUOTED_TYPES.contains(value.getClass());
        pairs.add(key + "=" + (unquoted ? value : "\"" + value + "\""));
    }
}
