package com.teknolojikpanda.findings.triage.util;

import javax.annotation.Nonnull;

/**
 * Names of the structured events written through {@link LogSupport}. The key is what appears
 * after {@code event=} in the log line.
 */
public enum LogEvent {
    INGEST_REJECTED("ingest.rejected"),
    INGEST_BATCH("ingest.batch"),
    DEDUP_CONFLICT("dedup.conflict"),
    ANALYZER_COMPLETED("analyzer.completed"),
    ANALYZER_FAILED("analyzer.failed"),
    ANALYZER_TIMEOUT("analyzer.timeout"),
    SYNTHESIS_COMPLETED("synthesis.completed"),
    BREAKER_OPEN("breaker.open"),
    BREAKER_HALF_OPEN("breaker.half_open"),
    BREAKER_CLOSED("breaker.closed"),
    SINK_FLUSH("sink.flush"),
    SINK_FLUSHED("sink.flushed"),
    SINK_CREATED("sink.created"),
    SINK_DEFERRED("sink.deferred"),
    SINK_PERSIST_FAILED("sink.persist_failed"),
    SINK_RETRY("sink.retry"),
    SINK_EXHAUSTED("sink.exhausted"),
    SINK_INTERRUPTED("sink.interrupted"),
    SINK_ERROR("sink.error"),
    TRIAGE_STARTED("triage.started"),
    TRIAGE_COMPLETED("triage.completed"),
    TRIAGE_CANCELLED("triage.cancelled"),
    TRIAGE_ABORTED("triage.aborted"),
    REVIEW_STARTED("review.started"),
    REVIEW_FINISHED("review.finished");

    private final String key;

    LogEvent(String key) {
        this.key = key;
    }

    @Nonnull
    public String getKey() {
        return key;
    }

    /**
     * Component part of the key, e.g. {@code sink} for {@code sink.retry}.
     */
    @Nonnull
    public String getComponent() {
        return key.substring(0, key.indexOf('.'));
    }
}
