package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the batch phase produced: analyzer outcomes, ingestion errors, the deduplicated set
 * and the sorted queue that goes to triage.
 */
public final class SynthesisResult {

    private final AnalyzerResults analyzerResults;
    private final IngestionResult ingestion;
    private final List<Finding> deduplicated;
    private final List<Finding> queue;
    private final int threshold;
    private final Map<String, Object> metrics;

    private SynthesisResult(Builder builder) {
        this.analyzerResults = Objects.requireNonNull(builder.analyzerResults, "analyzerResults");
        this.ingestion = Objects.requireNonNull(builder.ingestion, "ingestion");
        this.deduplicated = Collections.unmodifiableList(new ArrayList<>(builder.deduplicated));
        this.queue = Collections.unmodifiableList(new ArrayList<>(builder.queue));
        this.threshold = builder.threshold;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
    }

    @Nonnull
    public AnalyzerResults getAnalyzerResults() {
        return analyzerResults;
    }

    @Nonnull
    public IngestionResult getIngestion() {
        return ingestion;
    }

    public int getIngestedCount() {
        return ingestion.getFindings().size();
    }

    /**
     * Scored and merged findings before threshold filtering.
     */
    @Nonnull
    public List<Finding> getDeduplicated() {
        return deduplicated;
    }

    /**
     * Findings that survived filtering, in triage order.
     */
    @Nonnull
    public List<Finding> getQueue() {
        return queue;
    }

    public int getThreshold() {
        return threshold;
    }

    @Nonnull
    public ConfidenceDistribution getDistribution() {
        return ConfidenceDistribution.of(deduplicated);
    }

    @Nonnull
    public Map<Severity, Integer> getSeverityCounts() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Finding finding : queue) {
            counts.merge(finding.getSeverity(), 1, Integer::sum);
        }
        return counts;
    }

    public int getConflictCount() {
        return (int) deduplicated.stream().filter(Finding::isConflict).count();
    }

    @Nonnull
    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AnalyzerResults analyzerResults;
        private IngestionResult ingestion = IngestionResult.empty();
        private List<Finding> deduplicated = new ArrayList<>();
        private List<Finding> queue = new ArrayList<>();
        private int threshold = SynthesisConfig.DEFAULT_CONFIDENCE_THRESHOLD;
        private Map<String, Object> metrics = new LinkedHashMap<>();

        public Builder analyzerResults(@Nonnull AnalyzerResults value) {
            this.analyzerResults = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder ingestion(@Nonnull IngestionResult value) {
            this.ingestion = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder deduplicated(@Nonnull List<Finding> value) {
            this.deduplicated = new ArrayList<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder queue(@Nonnull List<Finding> value) {
            this.queue = new ArrayList<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder threshold(int value) {
            this.threshold = value;
            return this;
        }

        public Builder metrics(@Nonnull Map<String, Object> value) {
            this.metrics = new LinkedHashMap<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public SynthesisResult build() {
            return new SynthesisResult(this);
        }
    }
}
