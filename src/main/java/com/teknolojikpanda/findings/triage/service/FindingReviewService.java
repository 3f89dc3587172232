package com.teknolojikpanda.findings.triage.service;

import com.teknolojikpanda.findings.synth.api.Analyzer;
import com.teknolojikpanda.findings.synth.api.AnalyzerProgressListener;
import com.teknolojikpanda.findings.synth.api.DecisionProvider;
import com.teknolojikpanda.findings.synth.api.MetricsRecorder;
import com.teknolojikpanda.findings.synth.api.SubmissionStore;
import com.teknolojikpanda.findings.synth.api.TaskTracker;
import com.teknolojikpanda.findings.synth.api.TriageListener;
import com.teknolojikpanda.findings.synth.core.FindingSynthesisPipeline;
import com.teknolojikpanda.findings.synth.core.InMemoryMetricsRecorder;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.synth.model.SynthesisResult;
import com.teknolojikpanda.findings.synth.model.TriageDecision;
import com.teknolojikpanda.findings.triage.sink.InMemorySubmissionStore;
import com.teknolojikpanda.findings.triage.sink.JsonFileSubmissionStore;
import com.teknolojikpanda.findings.triage.sink.SinkReport;
import com.teknolojikpanda.findings.triage.sink.TaskSinkAdapter;
import com.teknolojikpanda.findings.triage.util.LogContext;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Runs a complete review: synthesis, triage and task submission.
 * <p>
 * Accepted findings are handed to the sink as they are decided, so they are durably queued even
 * if the session is cancelled afterwards. Queued submissions are flushed to the tracker once the
 * session stops, whether it completed or not.
 */
public class FindingReviewService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FindingReviewService.class);

    private final FindingSynthesisPipeline pipeline;
    private final SynthesisConfig config;
    private final TaskSinkAdapter sink;
    private final MetricsRecorder metrics;

    public FindingReviewService(@Nonnull FindingSynthesisPipeline pipeline,
                                @Nonnull SynthesisConfig config,
                                @Nonnull TaskSinkAdapter sink,
                                @Nonnull MetricsRecorder metrics) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Wires the default pipeline with a store chosen from the configuration: a JSON file when
     * {@code submissionStorePath} is set, memory otherwise.
     */
    @Nonnull
    public static FindingReviewService create(@Nonnull SynthesisConfig config, @Nonnull TaskTracker tracker) {
        SubmissionStore store = config.getSubmissionStorePath() != null
                ? new JsonFileSubmissionStore(config.getSubmissionStorePath())
                : new InMemorySubmissionStore();
        MetricsRecorder metrics = new InMemoryMetricsRecorder();
        return new FindingReviewService(FindingSynthesisPipeline.createDefault(), config,
                new TaskSinkAdapter(tracker, store, config, metrics), metrics);
    }

    @Nonnull
    public ReviewRun review(@Nonnull ReviewTarget target,
                            @Nonnull List<? extends Analyzer> analyzers,
                            @Nonnull DecisionProvider provider) {
        return review(target, analyzers, provider, null);
    }

    @Nonnull
    public ReviewRun review(@Nonnull ReviewTarget target,
                            @Nonnull List<? extends Analyzer> analyzers,
                            @Nonnull DecisionProvider provider,
                            @Nullable AnalyzerProgressListener progressListener) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(provider, "provider");
        try (LogContext ignored = LogContext.forReview(target)) {
            LogSupport.info(log, LogEvent.REVIEW_STARTED, null, "analyzers", analyzers.size());
            SynthesisResult synthesis = pipeline.run(target, analyzers, config, metrics, progressListener);
            TriageSession session = new TriageSession(synthesis.getQueue(), provider);
            session.addListener(new SinkEnqueueListener());
            return triage(target, synthesis, session, SinkReport.empty());
        }
    }

    /**
     * Continues a cancelled session where it stopped and flushes again.
     *
     * @throws IllegalStateException when the run's session already completed
     */
    @Nonnull
    public ReviewRun resume(@Nonnull ReviewRun run) {
        Objects.requireNonNull(run, "run");
        if (run.isComplete()) {
            throw new IllegalStateException("Session " + run.getSession().getSessionId() + " already completed");
        }
        try (LogContext ignored = LogContext.forReview(run.getTarget())) {
            return triage(run.getTarget(), run.getSynthesis(), run.getSession(), run.getSinkReport());
        }
    }

    /**
     * Retries every submission that previously ran out of attempts.
     */
    @Nonnull
    public SinkReport resubmitFailed() {
        return sink.resubmitFailed();
    }

    private ReviewRun triage(ReviewTarget target, SynthesisResult synthesis, TriageSession session, SinkReport previous) {
        session.run();
        SinkReport report = previous.plus(sink.flush());
        ReviewRun run = new ReviewRun(target, synthesis, session, report);
        TriageTranscript transcript = run.getTranscript();
        LogSupport.info(log, LogEvent.REVIEW_FINISHED, null,
                "incomplete", transcript.isIncomplete(),
                "ingested", transcript.getTotalIngested(),
                "surviving", transcript.getSurvivingThreshold(),
                "accepted", transcript.getAccepted(),
                "edited", transcript.getEdited(),
                "skipped", transcript.getSkipped(),
                "tasksCreated", transcript.getExternalIds().size(),
                "tasksFailed", transcript.getFailedSubmissions().size());
        return run;
    }

    @Nonnull
    public MetricsRecorder getMetrics() {
        return metrics;
    }

    @Override
    public void close() {
        sink.close();
    }

    private final class SinkEnqueueListener implements TriageListener {
        @Override
        public void onDecided(@Nonnull TriageDecision decision, @Nonnull Finding finding) {
            if (decision.getOutcome().createsTask()) {
                sink.enqueue(finding);
            }
        }
    }
}
