package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of runtime configuration used for a single synthesis and triage run.
 */
public final class SynthesisConfig {

    public static final int DEFAULT_CONFIDENCE_THRESHOLD = 80;

    private final int confidenceThreshold;
    private final long analyzerTimeoutMs;
    private final int analyzerParallelism;
    private final int trackerMaxAttempts;
    private final long trackerRetryDelayMs;
    private final long trackerMaxRetryDelayMs;
    private final int trackerBreakerThreshold;
    private final long trackerBreakerCooldownMs;
    private final List<String> trackerLabels;
    private final Path submissionStorePath;

    private SynthesisConfig(Builder builder) {
        this.confidenceThreshold = builder.confidenceThreshold;
        this.analyzerTimeoutMs = builder.analyzerTimeoutMs;
        this.analyzerParallelism = builder.analyzerParallelism;
        this.trackerMaxAttempts = builder.trackerMaxAttempts;
        this.trackerRetryDelayMs = builder.trackerRetryDelayMs;
        this.trackerMaxRetryDelayMs = builder.trackerMaxRetryDelayMs;
        this.trackerBreakerThreshold = builder.trackerBreakerThreshold;
        this.trackerBreakerCooldownMs = builder.trackerBreakerCooldownMs;
        this.trackerLabels = Collections.unmodifiableList(new ArrayList<>(builder.trackerLabels));
        this.submissionStorePath = builder.submissionStorePath;
    }

    public int getConfidenceThreshold() {
        return confidenceThreshold;
    }

    @Nonnull
    public Duration getAnalyzerTimeout() {
        return Duration.ofMillis(analyzerTimeoutMs);
    }

    /**
     * @return worker threads for analyzers; 0 means one thread per analyzer
     */
    public int getAnalyzerParallelism() {
        return analyzerParallelism;
    }

    public int getTrackerMaxAttempts() {
        return trackerMaxAttempts;
    }

    public long getTrackerRetryDelayMs() {
        return trackerRetryDelayMs;
    }

    public long getTrackerMaxRetryDelayMs() {
        return trackerMaxRetryDelayMs;
    }

    public int getTrackerBreakerThreshold() {
        return trackerBreakerThreshold;
    }

    @Nonnull
    public Duration getTrackerBreakerCooldown() {
        return Duration.ofMillis(trackerBreakerCooldownMs);
    }

    /**
     * Labels added to every tracker task on top of the per-finding ones.
     */
    @Nonnull
    public List<String> getTrackerLabels() {
        return trackerLabels;
    }

    @Nullable
    public Path getSubmissionStorePath() {
        return submissionStorePath;
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .confidenceThreshold(confidenceThreshold)
                .analyzerTimeoutMs(analyzerTimeoutMs)
                .analyzerParallelism(analyzerParallelism)
                .trackerMaxAttempts(trackerMaxAttempts)
                .trackerRetryDelayMs(trackerRetryDelayMs)
                .trackerMaxRetryDelayMs(trackerMaxRetryDelayMs)
                .trackerBreakerThreshold(trackerBreakerThreshold)
                .trackerBreakerCooldownMs(trackerBreakerCooldownMs)
                .trackerLabels(trackerLabels)
                .submissionStorePath(submissionStorePath);
    }

    public static SynthesisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private long analyzerTimeoutMs = 120_000;
        private int analyzerParallelism = 0;
        private int trackerMaxAttempts = 3;
        private long trackerRetryDelayMs = 1_000;
        private long trackerMaxRetryDelayMs = 30_000;
        private int trackerBreakerThreshold = 5;
        private long trackerBreakerCooldownMs = 60_000;
        private List<String> trackerLabels = Collections.singletonList("code-review");
        private Path submissionStorePath;

        public Builder confidenceThreshold(int value) {
            this.confidenceThreshold = value;
            return this;
        }

        public Builder analyzerTimeoutMs(long value) {
            this.analyzerTimeoutMs = value;
            return this;
        }

        public Builder analyzerTimeout(@Nonnull Duration value) {
            this.analyzerTimeoutMs = Objects.requireNonNull(value, "value").toMillis();
            return this;
        }

        public Builder analyzerParallelism(int value) {
            this.analyzerParallelism = value;
            return this;
        }

        public Builder trackerMaxAttempts(int value) {
            this.trackerMaxAttempts = value;
            return this;
        }

        public Builder trackerRetryDelayMs(long value) {
            this.trackerRetryDelayMs = value;
            return this;
        }

        public Builder trackerMaxRetryDelayMs(long value) {
            this.trackerMaxRetryDelayMs = value;
            return this;
        }

        public Builder trackerBreakerThreshold(int value) {
            this.trackerBreakerThreshold = value;
            return this;
        }

        public Builder trackerBreakerCooldownMs(long value) {
            this.trackerBreakerCooldownMs = value;
            return this;
        }

        public Builder trackerLabels(@Nonnull List<String> values) {
            this.trackerLabels = new ArrayList<>(Objects.requireNonNull(values, "values"));
            return this;
        }

        public Builder submissionStorePath(@Nullable Path value) {
            this.submissionStorePath = value;
            return this;
        }

        /**
         * @throws ConfigurationValidationException listing every invalid field
         */
        public SynthesisConfig build() {
            Map<String, String> errors = new LinkedHashMap<>();
            if (confidenceThreshold < 0 || confidenceThreshold > 100) {
                errors.put("confidenceThreshold", "must be between 0 and 100");
            }
            if (analyzerTimeoutMs <= 0) {
                errors.put("analyzerTimeoutMs", "must be positive");
            }
            if (analyzerParallelism < 0) {
                errors.put("analyzerParallelism", "must be 0 (one per analyzer) or positive");
            }
            if (trackerMaxAttempts < 1) {
                errors.put("trackerMaxAttempts", "must be at least 1");
            }
            if (trackerRetryDelayMs < 0) {
                errors.put("trackerRetryDelayMs", "must not be negative");
            }
            if (trackerMaxRetryDelayMs < trackerRetryDelayMs) {
                errors.put("trackerMaxRetryDelayMs", "must not be lower than trackerRetryDelayMs");
            }
            if (trackerBreakerThreshold < 1) {
                errors.put("trackerBreakerThreshold", "must be at least 1");
            }
            if (trackerBreakerCooldownMs < 0) {
                errors.put("trackerBreakerCooldownMs", "must not be negative");
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationValidationException(errors);
            }
            return new SynthesisConfig(this);
        }
    }
}
