package com.meltwater.rxjetstream.util;

import com.google.common.collect.ImmutableSet;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Logger class which provides a standardized way of outputting variables and their values.
 *
 * <p>
 * Example usage:
 * <pre>
 * Logger log = new Logger(JetStreamMessage.class);
 * log.infoWithParams("Sending acknowledgment.", "kind", AckKind.NAK, "attempt", 2);
 * </pre>
 * Which would output something like this (depending on you slf4j backend configuration):
 * <pre>com.meltwater.rxjetstream.JetStreamMessage INFO: Sending acknowledgment. [ kind="-NAK", attempt=2 ]</pre>
 * </p>
 *
 * <p>Note that variables must have a sane toString() method and that they must be given in key value pairs.</p>
 */
public class Logger {

    private static final Set<Class<?>> UNQUOTED_TYPES = ImmutableSet.<Class<?>>of(
            Boolean.class,
            Byte.class,
            Character.class,
            Double.class,
            Float.class,
            Integer.class,
            Long.class,
            Short.class);

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
        if (logger.isTraceEnabled()) {
            logger.trace(assemble(message, arguments));
        }
    }

    public void traceWithParams(String message, Throwable t, Object... arguments) {
        if (logger.isTraceEnabled()) {
            logger.trace(assemble(message, arguments), t);
        }
    }

    public void debugWithParams(String message, Object... arguments) {
        if (logger.isDebugEnabled()) {
            logger.debug(assemble(message, arguments));
        }
    }

    public void debugWithParams(String message, Throwable t, Object... arguments) {
        if (logger.isDebugEnabled()) {
            logger.debug(assemble(message, arguments), t);
        }
    }

    public void infoWithParams(String message, Object... arguments) {
        if (logger.isInfoEnabled()) {
            logger.info(assemble(message, arguments));
        }
    }

    public void infoWithParams(String message, Throwable t, Object... arguments) {
        if (logger.isInfoEnabled()) {
            logger.info(assemble(message, arguments), t);
        }
    }

    public void warnWithParams(String message, Object... arguments) {
        if (logger.isWarnEnabled()) {
            logger.warn(assemble(message, arguments));
        }
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        if (logger.isWarnEnabled()) {
            logger.warn(assemble(message, arguments), t);
        }
    }

    public void errorWithParams(String message, Object... arguments) {
        if (logger.isErrorEnabled()) {
            logger.error(assemble(message, arguments));
        }
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        if (logger.isErrorEnabled()) {
            logger.error(assemble(message, arguments), t);
        }
    }

    private String assemble(String message, Object[] arguments) {
        try {
            return buildLogMessage(message, arguments);
        } catch (IllegalArgumentException e) {
            logger.error(
                    "Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                    getName(), message, Arrays.toString(arguments));
            return message;
        }
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        final StringBuilder sb = new StringBuilder(message);
        if (arguments.length == 0) {
            return sb.toString();
        }
        sb.append(" [ ");
        for (int i = 0; i < arguments.length; i += 2) {
            append(sb, arguments[i], arguments[i + 1]);
            if (i + 2 < arguments.length) {
                sb.append(", ");
            }
        }
        sb.append(" ]");
        return sb.toString();
    }

    private void appendList(StringBuilder sb, Object key, List<?> list) {
        for (int i = 0; i < list.size(); i++) {
            append(sb, key, list.get(i));
            if (i + 1 < list.size()) {
                sb.append(", ");
            }
        }
    }

    private void append(StringBuilder sb, Object key, Object value) {
        if (value instanceof Object[]) {
            appendList(sb, key, Arrays.asList((Object[]) value));
        } else if (value instanceof List) {
            appendList(sb, key, (List<?>) value);
        } else {
            sb.append(key).append('=');
            if (value == null || UNQUOTED_TYPES.contains(value.getClass())) {
                sb.append(value);
            } else {
                sb.append('"').append(value).append('"');
            }
        }
    }
}
