package com.teknolojikpanda.findings.triage.util;

import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Scopes MDC entries for the lifetime of a try-with-resources block and restores the previous
 * values on close. Worker threads do not inherit the MDC; callers copy
 * {@link MDC#getCopyOfContextMap()} where a task must log under the same context.
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_KEY = "review.correlationId";
    public static final String TARGET_KEY = "review.target";
    public static final String SESSION_KEY = "triage.sessionId";

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previousValues = new LinkedHashMap<>();

    private LogContext(Map<String, String> values) {
        values.forEach((key, value) -> {
            if (key == null || value == null || value.isBlank()) {
                return;
            }
            keys.add(key);
            previousValues.put(key, MDC.get(key));
            MDC.put(key, value.trim());
        });
    }

    /**
     * Opens a review scope with a fresh correlation id unless one is already active.
     */
    @Nonnull
    public static LogContext forReview(@Nonnull ReviewTarget target) {
        Objects.requireNonNull(target, "target");
        Map<String, String> values = new LinkedHashMap<>();
        String current = MDC.get(CORRELATION_KEY);
        values.put(CORRELATION_KEY, current != null && !current.isBlank() ? current : UUID.randomUUID().toString());
        values.put(TARGET_KEY, target.getReference());
        return new LogContext(values);
    }

    @Nonnull
    public static LogContext forSession(@Nonnull String sessionId) {
        return scoped(SESSION_KEY, Objects.requireNonNull(sessionId, "sessionId"));
    }

    @Nonnull
    public static LogContext scoped(@Nullable String key, @Nullable String value) {
        Map<String, String> values = new LinkedHashMap<>();
        if (key != null && !key.isBlank()) {
            values.put(key, value);
        }
        return new LogContext(values);
    }

    /**
     * Re-applies a captured MDC map on a worker thread.
     */
    @Nonnull
    public static LogContext restore(@Nullable Map<String, String> captured) {
        return new LogContext(captured == null ? new LinkedHashMap<>() : captured);
    }

    @Nullable
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_KEY);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String key = keys.get(i);
            String previous = previousValues.get(key);
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
