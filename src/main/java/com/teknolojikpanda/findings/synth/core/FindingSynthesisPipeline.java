package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.api.Analyzer;
import com.teknolojikpanda.findings.synth.api.AnalyzerProgressListener;
import com.teknolojikpanda.findings.synth.api.MetricsRecorder;
import com.teknolojikpanda.findings.synth.model.AnalyzerResults;
import com.teknolojikpanda.findings.synth.model.AnalyzerStatus;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.IngestionResult;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.synth.model.SynthesisResult;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Named;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Batch phase of a review: gather analyzers, then ingest, score, merge, filter and sort.
 * Everything after the gather is single-threaded and runs on the caller's thread.
 */
@Named
public class FindingSynthesisPipeline {

    private static final Logger log = LoggerFactory.getLogger(FindingSynthesisPipeline.class);

    private final ConfidenceScorer scorer;
    private final FindingDeduplicator deduplicator;
    private final ThresholdFilter filter;
    private final PrioritySorter sorter;

    @Inject
    public FindingSynthesisPipeline(@Nonnull ConfidenceScorer scorer,
                                    @Nonnull FindingDeduplicator deduplicator,
                                    @Nonnull ThresholdFilter filter,
                                    @Nonnull PrioritySorter sorter) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.sorter = Objects.requireNonNull(sorter, "sorter");
    }

    public static FindingSynthesisPipeline createDefault() {
        ConfidenceScorer scorer = new ConfidenceScorer();
        return new FindingSynthesisPipeline(scorer, new FindingDeduplicator(scorer), new ThresholdFilter(), new PrioritySorter());
    }

    @Nonnull
    public SynthesisResult run(@Nonnull ReviewTarget target,
                               @Nonnull List<? extends Analyzer> analyzers,
                               @Nonnull SynthesisConfig config,
                               @Nonnull MetricsRecorder metrics,
                               @Nullable AnalyzerProgressListener listener) {
        Objects.requireNonNull(config, "config");
        Instant start = metrics.recordStart("synthesis.gather");
        AnalyzerResults results = new AnalyzerGatherer(config, metrics).gather(target, analyzers, listener);
        metrics.recordEnd("synthesis.gather", start);
        return synthesize(results, config.getConfidenceThreshold(), metrics);
    }

    /**
     * Runs the synchronous reductions over already gathered analyzer results. A fresh id
     * sequence is used for every call.
     */
    @Nonnull
    public SynthesisResult synthesize(@Nonnull AnalyzerResults results, int threshold, @Nonnull MetricsRecorder metrics) {
        Objects.requireNonNull(results, "results");
        Objects.requireNonNull(metrics, "metrics");
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within [0, 100]: " + threshold);
        }
        Instant start = metrics.recordStart("synthesis.reduce");

        IngestionResult ingestion = new FindingIngestor().ingest(results);
        List<Finding> scored = scorer.scoreAll(ingestion.getFindings());
        List<Finding> deduplicated = deduplicator.merge(scored);
        List<Finding> queue = sorter.sort(filter.filter(deduplicated, threshold));

        long conflicts = deduplicated.stream().filter(Finding::isConflict).count();
        metrics.increment("findings.ingested", ingestion.getFindings().size());
        metrics.increment("findings.rejected", ingestion.getErrors().size());
        metrics.increment("findings.merged", scored.size() - deduplicated.size());
        metrics.increment("findings.conflicts", conflicts);
        metrics.increment("findings.filtered", deduplicated.size() - queue.size());
        metrics.recordMetric("findings.queued", queue.size());
        metrics.recordEnd("synthesis.reduce", start);

        LogSupport.info(log, LogEvent.SYNTHESIS_COMPLETED, "Findings ready for triage",
                "analyzers", results.size(),
                "timedOut", results.idsWithStatus(AnalyzerStatus.TIMED_OUT).size(),
                "failed", results.idsWithStatus(AnalyzerStatus.FAILED).size(),
                "ingested", ingestion.getFindings().size(),
                "rejected", ingestion.getErrors().size(),
                "deduplicated", deduplicated.size(),
                "conflicts", conflicts,
                "queued", queue.size(),
                "threshold", threshold);

        return SynthesisResult.builder()
                .analyzerResults(results)
                .ingestion(ingestion)
                .deduplicated(deduplicated)
                .queue(queue)
                .threshold(threshold)
                .metrics(metrics.snapshot())
                .build();
    }
}
