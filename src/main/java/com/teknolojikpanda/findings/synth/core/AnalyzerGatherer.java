package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.api.Analyzer;
import com.teknolojikpanda.findings.synth.api.AnalyzerProgressListener;
import com.teknolojikpanda.findings.synth.api.MetricsRecorder;
import com.teknolojikpanda.findings.synth.model.AnalyzerResult;
import com.teknolojikpanda.findings.synth.model.AnalyzerResults;
import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.triage.util.LogContext;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyzers concurrently and joins them with partial failure tolerance.
 * <p>
 * Every analyzer gets its own deadline, counted from the moment a worker picks it up. An
 * analyzer that throws or misses its deadline is cancelled, logged at WARN and recorded with an
 * empty contribution; the others are unaffected. The returned results keep registration order.
 */
public class AnalyzerGatherer {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerGatherer.class);

    private final SynthesisConfig config;
    private final MetricsRecorder metrics;

    public AnalyzerGatherer(@Nonnull SynthesisConfig config, @Nonnull MetricsRecorder metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Nonnull
    public AnalyzerResults gather(@Nonnull ReviewTarget target,
                                  @Nonnull List<? extends Analyzer> analyzers,
                                  @Nullable AnalyzerProgressListener listener) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(analyzers, "analyzers");
        AnalyzerProgressListener progress = listener != null ? listener : new AnalyzerProgressListener() { };
        if (analyzers.isEmpty()) {
            return new AnalyzerResults(Collections.emptyList());
        }
        checkUniqueIds(analyzers);

        int total = analyzers.size();
        int threads = config.getAnalyzerParallelism() == 0
                ? total
                : Math.min(config.getAnalyzerParallelism(), total);
        long timeoutNanos = config.getAnalyzerTimeout().toNanos();
        long waves = (total + threads - 1) / threads;
        long startDeadline = System.nanoTime() + timeoutNanos * waves;

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService executor = Executors.newFixedThreadPool(threads, new AnalyzerThreadFactory());
        List<AnalyzerTask> tasks = new ArrayList<>(total);
        List<Future<List<RawFinding>>> futures = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                AnalyzerTask task = new AnalyzerTask(analyzers.get(i), target, i, total, progress, mdc);
                tasks.add(task);
                futures.add(executor.submit(task));
            }

            List<AnalyzerResult> results = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                AnalyzerResult result = join(tasks.get(i), futures.get(i), timeoutNanos, startDeadline);
                results.add(result);
                progress.onAnalyzerCompleted(result, i, total);
            }
            return new AnalyzerResults(results);
        } finally {
            executor.shutdownNow();
        }
    }

    private AnalyzerResult join(AnalyzerTask task, Future<List<RawFinding>> future, long timeoutNanos, long startDeadline) {
        String analyzerId = task.analyzerId;
        try {
            if (!task.awaitStart(startDeadline - System.nanoTime())) {
                future.cancel(true);
                return timedOut(analyzerId, Duration.ZERO, "Analyzer never started before the run deadline");
            }
            long remaining = task.startNanos + timeoutNanos - System.nanoTime();
            List<RawFinding> payloads = future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            Duration elapsed = task.elapsed();
            metrics.increment("analyzers.completed");
            metrics.recordMetric("analyzer." + analyzerId + ".payloads", payloads.size());
            LogSupport.debug(log, LogEvent.ANALYZER_COMPLETED, null,
                    "analyzer", analyzerId,
                    "payloads", payloads.size(),
                    "elapsedMs", elapsed.toMillis());
            return AnalyzerResult.completed(analyzerId, payloads, elapsed);
        } catch (TimeoutException e) {
            future.cancel(true);
            return timedOut(analyzerId, Duration.ofNanos(timeoutNanos), "Analyzer exceeded its timeout; continuing without its findings");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            metrics.increment("analyzers.failed");
            LogSupport.warn(log, LogEvent.ANALYZER_FAILED, "Analyzer failed; continuing without its findings", cause,
                    "analyzer", analyzerId,
                    "error", cause.getClass().getSimpleName() + ": " + cause.getMessage());
            return AnalyzerResult.failed(analyzerId, describe(cause), task.elapsed());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.increment("analyzers.failed");
            LogSupport.warn(log, LogEvent.ANALYZER_FAILED, "Interrupted while waiting for analyzer", "analyzer", analyzerId);
            return AnalyzerResult.failed(analyzerId, "Interrupted while waiting for analyzer", task.elapsed());
        }
    }

    private AnalyzerResult timedOut(String analyzerId, Duration elapsed, String message) {
        metrics.increment("analyzers.timedOut");
        LogSupport.warn(log, LogEvent.ANALYZER_TIMEOUT, message,
                "analyzer", analyzerId,
                "timeoutMs", config.getAnalyzerTimeout().toMillis());
        return AnalyzerResult.timedOut(analyzerId, elapsed);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private static void checkUniqueIds(List<? extends Analyzer> analyzers) {
        Set<String> seen = new HashSet<>();
        for (Analyzer analyzer : analyzers) {
            if (!seen.add(Objects.requireNonNull(analyzer.getId(), "analyzer id"))) {
                throw new IllegalArgumentException("Duplicate analyzer id: " + analyzer.getId());
            }
        }
    }

    private final class AnalyzerTask implements Callable<List<RawFinding>> {
        private final Analyzer analyzer;
        private final String analyzerId;
        private final ReviewTarget target;
        private final int index;
        private final int total;
        private final AnalyzerProgressListener listener;
        private final Map<String, String> mdc;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;
        private volatile long endNanos;

        AnalyzerTask(Analyzer analyzer, ReviewTarget target, int index, int total,
                     AnalyzerProgressListener listener, @Nullable Map<String, String> mdc) {
            this.analyzer = analyzer;
            this.analyzerId = analyzer.getId();
            this.target = target;
            this.index = index;
            this.total = total;
            this.listener = listener;
            this.mdc = mdc;
        }

        @Override
        public List<RawFinding> call() throws Exception {
            startNanos = System.nanoTime();
            started.countDown();
            Instant start = metrics.recordStart("analyzer." + analyzerId);
            try (LogContext ignored = LogContext.restore(mdc);
                 LogContext analyzerScope = LogContext.scoped("analyzer.id", analyzerId)) {
                listener.onAnalyzerStarted(analyzerId, index, total);
                List<RawFinding> payloads = analyzer.analyze(target);
                return payloads == null ? Collections.emptyList() : new ArrayList<>(payloads);
            } finally {
                endNanos = System.nanoTime();
                metrics.recordEnd("analyzer." + analyzerId, start);
            }
        }

        boolean awaitStart(long timeoutNanos) throws InterruptedException {
            return started.await(Math.max(0L, timeoutNanos), TimeUnit.NANOSECONDS);
        }

        Duration elapsed() {
            long end = endNanos != 0L ? endNanos : System.nanoTime();
            return startNanos == 0L ? Duration.ZERO : Duration.ofNanos(end - startNanos);
        }
    }

    private static final class AnalyzerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final AtomicInteger threadCounter = new AtomicInteger();
        private final String prefix = "analyzer-worker-" + POOL_COUNTER.incrementAndGet() + "-";

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
