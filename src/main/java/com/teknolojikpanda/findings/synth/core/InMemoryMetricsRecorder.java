package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.api.MetricsRecorder;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe recorder backing one run. Timings are stored as {@code <key>.durationMs},
 * counters as plain longs and gauges as given.
 */
public final class InMemoryMetricsRecorder implements MetricsRecorder {

    private final Clock clock;
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public InMemoryMetricsRecorder() {
        this(Clock.systemUTC());
    }

    public InMemoryMetricsRecorder(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Nonnull
    @Override
    public Instant recordStart(@Nonnull String key) {
        Objects.requireNonNull(key, "key");
        return clock.instant();
    }

    @Override
    public void recordEnd(@Nonnull String key, @Nonnull Instant start) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(start, "start");
        values.put(key + ".durationMs", Duration.between(start, clock.instant()).toMillis());
    }

    @Override
    public void increment(@Nonnull String key) {
        increment(key, 1);
    }

    @Override
    public void increment(@Nonnull String key, long delta) {
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k -> new AtomicLong()).addAndGet(delta);
    }

    @Override
    public void recordMetric(@Nonnull String key, @Nullable Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    public long counter(@Nonnull String key) {
        AtomicLong counter = counters.get(key);
        return counter == null ? 0L : counter.get();
    }

    @Nonnull
    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new TreeMap<>(values);
        counters.forEach((key, value) -> snapshot.put(key, value.get()));
        return snapshot;
    }
}
