package com.teknolojikpanda.findings.triage.util;

import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Writes {@link LogEvent}s as single lines: {@code event=<key> message="..." key=value ...}.
 * Numbers, booleans and enum constants (severities, categories, statuses) are written bare;
 * collections are joined with commas and quoted like any other value. Null values are left out.
 */
public final class LogSupport {

    private LogSupport() {
    }

    public static void info(Logger logger, LogEvent event, @Nullable String message, Object... fields) {
        if (logger.isInfoEnabled()) {
            logger.info(format(event, message, fields));
        }
    }

    public static void debug(Logger logger, LogEvent event, @Nullable String message, Object... fields) {
        if (logger.isDebugEnabled()) {
            logger.debug(format(event, message, fields));
        }
    }

    public static void warn(Logger logger, LogEvent event, @Nullable String message, Object... fields) {
        if (logger.isWarnEnabled()) {
            logger.warn(format(event, message, fields));
        }
    }

    public static void warn(Logger logger, LogEvent event, @Nullable String message, Throwable error, Object... fields) {
        if (logger.isWarnEnabled()) {
            logger.warn(format(event, message, fields), error);
        }
    }

    public static void error(Logger logger, LogEvent event, @Nullable String message, Throwable error, Object... fields) {
        logger.error(format(event, message, fields), error);
    }

    /**
     * @throws IllegalArgumentException when {@code fields} is not a sequence of key/value pairs
     */
    @Nonnull
    public static String format(@Nonnull LogEvent event, @Nullable String message, Object... fields) {
        if (fields != null && fields.length % 2 != 0) {
            throw new IllegalArgumentException("Fields must be provided as key/value pairs");
        }
        StringBuilder sb = new StringBuilder("event=").append(event.getKey());
        if (message != null && !message.isBlank()) {
            sb.append(" message=\"").append(sanitize(message)).append('"');
        }
        for (int i = 0; fields != null && i < fields.length; i += 2) {
            String key = fields[i] == null ? "" : String.valueOf(fields[i]).trim();
            Object value = fields[i + 1];
            if (key.isEmpty() || value == null) {
                continue;
            }
            sb.append(' ').append(key).append('=');
            appendValue(sb, value);
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Enum) {
            sb.append(((Enum<?>) value).name());
        } else if (value instanceof Collection) {
            String joined = ((Collection<?>) value).stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(","));
            sb.append('"').append(sanitize(joined)).append('"');
        } else {
            sb.append('"').append(sanitize(String.valueOf(value))).append('"');
        }
    }

    private static String sanitize(String value) {
        return value.replace('\n', ' ').replace('\r', ' ').replace("\"", "'");
    }
}
