package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.api.MetricsRecorder;
import com.teknolojikpanda.findings.synth.api.SubmissionStore;
import com.teknolojikpanda.findings.synth.api.TaskTracker;
import com.teknolojikpanda.findings.synth.core.FindingKeyUtil;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;
import com.teknolojikpanda.findings.triage.util.CircuitBreaker;
import com.teknolojikpanda.findings.triage.util.LogContext;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns accepted findings into tracker tasks.
 * <p>
 * {@link #enqueue(Finding)} records a pending {@link TaskSubmission} in the store before any
 * tracker call is made. {@link #flush()} then submits every pending entry. Each submission
 * retries on its own schedule with exponential backoff, so a slow or failing one never holds
 * back the rest. While the tracker circuit is open a submission waits for the cooldown instead
 * of spending attempts on calls that never reach the tracker. A submission that runs out of attempts is stored as {@code FAILED} and
 * reported, never dropped; {@link #resubmitFailed()} gives it a fresh attempt budget.
 */
public class TaskSinkAdapter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskSinkAdapter.class);
    private static final int MAX_SCHEDULER_THREADS = 4;

    private final TaskTracker tracker;
    private final SubmissionStore store;
    private final SynthesisConfig config;
    private final MetricsRecorder metrics;
    private final CircuitBreaker breaker;
    private final ScheduledExecutorService scheduler;
    private final Map<String, TaskSubmission> unsaved = new ConcurrentHashMap<>();

    public TaskSinkAdapter(@Nonnull TaskTracker tracker,
                           @Nonnull SubmissionStore store,
                           @Nonnull SynthesisConfig config,
                           @Nonnull MetricsRecorder metrics) {
        this(tracker, store, config, metrics,
                new CircuitBreaker("task-tracker", config.getTrackerBreakerThreshold(), config.getTrackerBreakerCooldown()));
    }

    public TaskSinkAdapter(@Nonnull TaskTracker tracker,
                           @Nonnull SubmissionStore store,
                           @Nonnull SynthesisConfig config,
                           @Nonnull MetricsRecorder metrics,
                           @Nonnull CircuitBreaker breaker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.scheduler = Executors.newScheduledThreadPool(MAX_SCHEDULER_THREADS, new SinkThreadFactory());
    }

    /**
     * Durably records a pending submission for an accepted finding. A finding that already has
     * a submission keeps it.
     */
    @Nonnull
    public TaskSubmission enqueue(@Nonnull Finding finding) {
        Objects.requireNonNull(finding, "finding");
        TaskSubmission existing = store.get(finding.getId());
        if (existing != null) {
            log.debug("Finding {} already has a submission ({})", finding.getId(), existing.getStatus());
            return existing;
        }
        TaskSubmission submission = TaskSubmission.pending(
                finding.getId(),
                finding.getTitle(),
                describe(finding),
                finding.getSeverity().toPriority(),
                labels(finding));
        store.save(submission);
        metrics.increment("tracker.enqueued");
        return submission;
    }

    /**
     * Submits every pending submission in the store, including ones left over from an earlier run.
     * Blocks until each has either succeeded or exhausted its attempts, waiting out the breaker
     * cooldown when the tracker circuit is open.
     */
    @Nonnull
    public SinkReport flush() {
        List<TaskSubmission> outcomes = new ArrayList<>();
        List<TaskSubmission> pending = new ArrayList<>();
        for (TaskSubmission submission : store.findByStatus(SubmissionStatus.PENDING)) {
            TaskSubmission created = unsaved.get(submission.getFindingId());
            if (created != null) {
                persistCreated(created);
                outcomes.add(created);
            } else {
                pending.add(submission);
            }
        }
        if (pending.isEmpty() && outcomes.isEmpty()) {
            return SinkReport.empty();
        }
        LogSupport.info(log, LogEvent.SINK_FLUSH, "Submitting tasks", "pending", pending.size());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<TaskSubmission>> futures = new ArrayList<>(pending.size());
        for (TaskSubmission submission : pending) {
            CompletableFuture<TaskSubmission> future = new CompletableFuture<>();
            futures.add(future);
            schedule(submission, 0L, future, mdc);
        }
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), pending.get(i)));
        }
        SinkReport report = new SinkReport(outcomes);
        LogSupport.info(log, LogEvent.SINK_FLUSHED, null,
                "submitted", report.getSubmitted().size(),
                "failed", report.getFailed().size(),
                "pending", report.getPending().size());
        return report;
    }

    /**
     * Puts every failed submission back in the queue with a fresh attempt budget and flushes.
     */
    @Nonnull
    public SinkReport resubmitFailed() {
        for (TaskSubmission failed : store.findByStatus(SubmissionStatus.FAILED)) {
            store.save(failed.reopened());
        }
        return flush();
    }

    /**
     * @throws IllegalArgumentException when no failed submission exists for the finding
     */
    @Nonnull
    public SinkReport resubmit(@Nonnull String findingId) {
        TaskSubmission submission = store.get(findingId);
        if (submission == null || submission.getStatus() != SubmissionStatus.FAILED) {
            throw new IllegalArgumentException("No failed submission for finding " + findingId);
        }
        store.save(submission.reopened());
        return flush();
    }

    @Nonnull
    public CircuitBreaker getBreaker() {
        return breaker;
    }

    private void schedule(TaskSubmission submission, long delayMs, CompletableFuture<TaskSubmission> future,
                          @Nullable Map<String, String> mdc) {
        scheduler.schedule(() -> {
            try (LogContext ignored = LogContext.restore(mdc)) {
                attempt(submission, future, mdc);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private void attempt(TaskSubmission submission, CompletableFuture<TaskSubmission> future,
                         @Nullable Map<String, String> mdc) {
        String externalId;
        try {
            externalId = breaker.execute(() -> {
                metrics.increment("tracker.attempts");
                return tracker.createTask(
                        submission.getTitle(),
                        submission.getDescription(),
                        submission.getPriority(),
                        submission.getLabels());
            });
        } catch (CircuitBreaker.CircuitBreakerOpenException e) {
            defer(submission, future, mdc);
            return;
        } catch (Exception e) {
            onFailure(submission, e, future, mdc);
            return;
        }
        TaskSubmission done = submission.withSuccess(externalId);
        metrics.increment("tracker.created");
        LogSupport.info(log, LogEvent.SINK_CREATED, null,
                "finding", done.getFindingId(),
                "externalId", externalId,
                "attempts", done.getAttempts());
        persistCreated(done);
        future.complete(done);
    }

    /**
     * The tracker was never reached, so no attempt is charged; the same submission runs again
     * once the circuit allows a trial call.
     */
    private void defer(TaskSubmission submission, CompletableFuture<TaskSubmission> future,
                       @Nullable Map<String, String> mdc) {
        long delay = Math.max(1L, breaker.remainingCooldown().toMillis());
        metrics.increment("tracker.deferred");
        LogSupport.debug(log, LogEvent.SINK_DEFERRED, "Tracker circuit open, waiting for cooldown",
                "finding", submission.getFindingId(),
                "attempts", submission.getAttempts(),
                "delayMs", delay);
        schedule(submission, delay, future, mdc);
    }

    /**
     * Records a created task. If the store rejects it the result is kept in memory, so a later
     * flush in this process saves it again instead of creating a second task.
     */
    private void persistCreated(TaskSubmission done) {
        try {
            store.save(done);
            unsaved.remove(done.getFindingId());
        } catch (RuntimeException e) {
            unsaved.put(done.getFindingId(), done);
            LogSupport.error(log, LogEvent.SINK_PERSIST_FAILED, "Task created but its submission could not be saved", e,
                    "finding", done.getFindingId(),
                    "externalId", done.getExternalId());
        }
    }

    private void onFailure(TaskSubmission submission, Exception error, CompletableFuture<TaskSubmission> future,
                           @Nullable Map<String, String> mdc) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        boolean exhausted = submission.getAttempts() + 1 >= config.getTrackerMaxAttempts();
        TaskSubmission failed = submission.withFailure(message, exhausted);
        store.save(failed);
        metrics.increment("tracker.failures");
        if (exhausted) {
            metrics.increment("tracker.exhausted");
            LogSupport.warn(log, LogEvent.SINK_EXHAUSTED, "Tracker submission failed after all attempts; kept for resubmission",
                    "finding", failed.getFindingId(),
                    "attempts", failed.getAttempts(),
                    "error", message);
            future.complete(failed);
            return;
        }
        long delay = backoffDelay(failed.getAttempts());
        LogSupport.warn(log, LogEvent.SINK_RETRY, "Tracker submission failed, retrying",
                "finding", failed.getFindingId(),
                "attempt", failed.getAttempts(),
                "maxAttempts", config.getTrackerMaxAttempts(),
                "delayMs", delay,
                "error", message);
        schedule(failed, delay, future, mdc);
    }

    /**
     * Delay before the next attempt once {@code attemptsSoFar} attempts have failed:
     * base × 2^(attemptsSoFar − 1), capped.
     */
    long backoffDelay(int attemptsSoFar) {
        long base = config.getTrackerRetryDelayMs();
        long max = config.getTrackerMaxRetryDelayMs();
        int exponent = Math.max(0, Math.min(attemptsSoFar - 1, 30));
        long delay = base * (1L << exponent);
        return delay < 0 ? max : Math.min(delay, max);
    }

    private TaskSubmission await(CompletableFuture<TaskSubmission> future, TaskSubmission original) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LogSupport.warn(log, LogEvent.SINK_INTERRUPTED, "Interrupted while waiting for tracker submission",
                    "finding", original.getFindingId());
        } catch (ExecutionException e) {
            LogSupport.error(log, LogEvent.SINK_ERROR, "Unexpected error while submitting task", e.getCause(),
                    "finding", original.getFindingId());
        }
        TaskSubmission latest = store.get(original.getFindingId());
        return latest != null ? latest : original;
    }

    private String describe(Finding finding) {
        StringBuilder sb = new StringBuilder();
        if (!finding.getDescription().isEmpty()) {
            sb.append(finding.getDescription()).append("\n\n");
        }
        sb.append("Location: ").append(finding.locationDisplay()).append('\n');
        sb.append("Severity: ").append(finding.getSeverity())
                .append(" | Category: ").append(finding.getCategory().label())
                .append(" | Confidence: ").append(finding.getConfidence()).append('\n');
        sb.append("Reported by: ").append(finding.getSourceAnalyzer());
        if (!finding.getMergedFrom().isEmpty()) {
            sb.append(" (merged ").append(String.join(", ", finding.getMergedFrom())).append(')');
        }
        sb.append('\n');
        if (finding.isConflict()) {
            sb.append("Note: analyzers disagreed on the severity of this finding.\n");
        }
        if (!finding.getEvidenceSnippets().isEmpty()) {
            sb.append("\nEvidence:\n");
            for (String snippet : finding.getEvidenceSnippets()) {
                sb.append("```\n").append(snippet).append("\n```\n");
            }
        }
        sb.append("\nFingerprint: ").append(FindingKeyUtil.fingerprint(finding));
        return sb.toString();
    }

    private List<String> labels(Finding finding) {
        Set<String> labels = new LinkedHashSet<>();
        labels.add(finding.getCategory().label());
        labels.add("analyzer:" + finding.getSourceAnalyzer());
        labels.addAll(config.getTrackerLabels());
        return new ArrayList<>(labels);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private static final class SinkThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final AtomicInteger threadCounter = new AtomicInteger();
        private final String prefix = "task-sink-" + POOL_COUNTER.incrementAndGet() + "-";

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
