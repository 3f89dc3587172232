package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of evaluating a single analyzer. Timed-out and failed analyzers carry no payloads.
 */
public final class AnalyzerResult {

    private final String analyzerId;
    private final AnalyzerStatus status;
    private final List<RawFinding> payloads;
    private final String error;
    private final Duration elapsed;

    private AnalyzerResult(Builder builder) {
        this.analyzerId = Objects.requireNonNull(builder.analyzerId, "analyzerId");
        this.status = Objects.requireNonNull(builder.status, "status");
        this.payloads = status == AnalyzerStatus.COMPLETED
                ? Collections.unmodifiableList(builder.payloads)
                : Collections.emptyList();
        this.error = builder.error;
        this.elapsed = builder.elapsed;
    }

    @Nonnull
    public String getAnalyzerId() {
        return analyzerId;
    }

    @Nonnull
    public AnalyzerStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == AnalyzerStatus.COMPLETED;
    }

    @Nonnull
    public List<RawFinding> getPayloads() {
        return payloads;
    }

    @Nullable
    public String getError() {
        return error;
    }

    @Nonnull
    public Duration getElapsed() {
        return elapsed;
    }

    public static AnalyzerResult completed(@Nonnull String analyzerId, @Nonnull List<RawFinding> payloads, @Nonnull Duration elapsed) {
        return builder().analyzerId(analyzerId).status(AnalyzerStatus.COMPLETED).payloads(payloads).elapsed(elapsed).build();
    }

    public static AnalyzerResult timedOut(@Nonnull String analyzerId, @Nonnull Duration elapsed) {
        return builder().analyzerId(analyzerId)
                .status(AnalyzerStatus.TIMED_OUT)
                .error("Timed out after " + elapsed.toMillis() + " ms")
                .elapsed(elapsed)
                .build();
    }

    public static AnalyzerResult failed(@Nonnull String analyzerId, @Nullable String error, @Nonnull Duration elapsed) {
        return builder().analyzerId(analyzerId).status(AnalyzerStatus.FAILED).error(error).elapsed(elapsed).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String analyzerId;
        private AnalyzerStatus status = AnalyzerStatus.COMPLETED;
        private List<RawFinding> payloads = new java.util.ArrayList<>();
        private String error;
        private Duration elapsed = Duration.ZERO;

        public Builder analyzerId(@Nonnull String value) {
            this.analyzerId = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder status(@Nonnull AnalyzerStatus value) {
            this.status = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder payloads(@Nonnull List<RawFinding> value) {
            this.payloads = new java.util.ArrayList<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder error(@Nullable String value) {
            this.error = value;
            return this;
        }

        public Builder elapsed(@Nonnull Duration value) {
            this.elapsed = Objects.requireNonNull(value, "value");
            return this;
        }

        public AnalyzerResult build() {
            return new AnalyzerResult(this);
        }
    }
}
