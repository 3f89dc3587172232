package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.api.TaskTracker;
import com.teknolojikpanda.findings.synth.api.TaskTrackerException;
import com.teknolojikpanda.findings.synth.core.InMemoryMetricsRecorder;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.LineRange;
import com.teknolojikpanda.findings.synth.model.Severity;
import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.synth.model.TaskPriority;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;
import com.teknolojikpanda.findings.triage.util.CircuitBreaker;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TaskSinkAdapterTest {

    private static final SynthesisConfig FAST_RETRIES = SynthesisConfig.builder()
            .trackerMaxAttempts(3)
            .trackerRetryDelayMs(1)
            .trackerMaxRetryDelayMs(5)
            .trackerLabels(Arrays.asList("code-review", "security"))
            .build();

    private TaskTracker tracker;
    private InMemorySubmissionStore store;
    private InMemoryMetricsRecorder metrics;
    private TaskSinkAdapter adapter;

    @Before
    public void setUp() {
        tracker = mock(TaskTracker.class);
        store = new InMemorySubmissionStore();
        metrics = new InMemoryMetricsRecorder();
        adapter = new TaskSinkAdapter(tracker, store, FAST_RETRIES, metrics);
    }

    @After
    public void tearDown() {
        adapter.close();
    }

    @Test
    public void succeedsOnThirdAttempt() throws Exception {
        when(tracker.createTask(anyString(), anyString(), any(TaskPriority.class), anyList()))
                .thenThrow(new TaskTrackerException("503 from tracker"))
                .thenThrow(new TaskTrackerException("timeout"))
                .thenReturn("bd-abc1");

        adapter.enqueue(finding("F-00001", Severity.P1));
        SinkReport report = adapter.flush();

        TaskSubmission submission = store.get("F-00001");
        assertEquals(SubmissionStatus.SUBMITTED, submission.getStatus());
        assertEquals("bd-abc1", submission.getExternalId());
        assertEquals(3, submission.getAttempts());
        assertEquals(Collections.singletonList("bd-abc1"), report.getExternalIds());
        assertTrue(report.isComplete());
        assertEquals(3L, metrics.counter("tracker.attempts"));
        assertEquals(2L, metrics.counter("tracker.failures"));
    }

    @Test
    public void exhaustedSubmissionIsKeptAndCanBeResubmitted() throws Exception {
        when(tracker.createTask(anyString(), anyString(), any(TaskPriority.class), anyList()))
                .thenThrow(new TaskTrackerException("down"))
                .thenThrow(new TaskTrackerException("down"))
                .thenThrow(new TaskTrackerException("still down"))
                .thenReturn("bd-9x");

        adapter.enqueue(finding("F-00004", Severity.P2));
        SinkReport report = adapter.flush();

        assertEquals(1, report.getFailed().size());
        assertFalse(report.isComplete());
        TaskSubmission failed = store.get("F-00004");
        assertEquals(SubmissionStatus.FAILED, failed.getStatus());
        assertEquals(3, failed.getAttempts());
        assertEquals("still down", failed.getLastError());
        assertNull(failed.getExternalId());

        SinkReport retried = adapter.resubmitFailed();

        assertEquals(Collections.singletonList("bd-9x"), retried.getExternalIds());
        assertEquals(SubmissionStatus.SUBMITTED, store.get("F-00004").getStatus());
        assertEquals(1, store.get("F-00004").getAttempts());
    }

    @Test
    public void slowRetryDoesNotHoldBackOtherSubmissions() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        TaskTracker flaky = (title, description, priority, labels) -> {
            calls.add(title);
            if (title.equals("A") && calls.stream().filter("A"::equals).count() == 1) {
                throw new TaskTrackerException("first attempt fails");
            }
            return "bd-" + title.toLowerCase();
        };
        SynthesisConfig config = FAST_RETRIES.toBuilder()
                .trackerRetryDelayMs(200)
                .trackerMaxRetryDelayMs(200)
                .build();
        try (TaskSinkAdapter sink = new TaskSinkAdapter(flaky, store, config, metrics)) {
            sink.enqueue(finding("F-00001", Severity.P1).toBuilder().title("A").build());
            sink.enqueue(finding("F-00002", Severity.P1).toBuilder().title("B").build());

            SinkReport report = sink.flush();

            assertEquals(2, report.getSubmitted().size());
            assertEquals(3, calls.size());
            assertEquals("A", calls.get(2));
            assertTrue(calls.indexOf("B") < calls.lastIndexOf("A"));
        }
    }

    @Test
    public void callBlockedByOpenBreakerWaitsWithoutUsingAnAttempt() throws Exception {
        when(tracker.createTask(anyString(), anyString(), any(TaskPriority.class), anyList()))
                .thenThrow(new TaskTrackerException("unreachable"))
                .thenReturn("bd-7");
        CircuitBreaker breaker = new CircuitBreaker("task-tracker", 1, Duration.ofMillis(100));
        try (TaskSinkAdapter sink = new TaskSinkAdapter(tracker, store, FAST_RETRIES, metrics, breaker)) {
            sink.enqueue(finding("F-00001", Severity.P3));

            SinkReport report = sink.flush();

            verify(tracker, times(2)).createTask(anyString(), anyString(), any(TaskPriority.class), anyList());
            assertEquals(Collections.singletonList("bd-7"), report.getExternalIds());
            assertEquals(2, store.get("F-00001").getAttempts());
            assertEquals(2L, metrics.counter("tracker.attempts"));
            assertTrue(breaker.getBlockedCalls() >= 1);
            assertTrue(metrics.counter("tracker.deferred") >= 1);
            assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        }
    }

    @Test
    public void failingSubmissionsDoNotStarveAHealthyOne() {
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        TaskTracker mixed = (title, description, priority, labels) -> {
            int call = calls.computeIfAbsent(title, t -> new AtomicInteger()).incrementAndGet();
            if (title.startsWith("broken") || call == 1) {
                throw new TaskTrackerException("tracker rejected " + title);
            }
            return "bd-" + title;
        };
        SynthesisConfig config = FAST_RETRIES.toBuilder()
                .trackerRetryDelayMs(50)
                .trackerMaxRetryDelayMs(50)
                .trackerBreakerThreshold(5)
                .trackerBreakerCooldownMs(100)
                .build();
        try (TaskSinkAdapter sink = new TaskSinkAdapter(mixed, store, config, metrics)) {
            for (int i = 1; i <= 5; i++) {
                sink.enqueue(finding("F-0000" + i, Severity.P2).toBuilder().title("broken-" + i).build());
            }
            sink.enqueue(finding("F-00006", Severity.P1).toBuilder().title("healthy").build());

            SinkReport report = sink.flush();

            TaskSubmission healthy = store.get("F-00006");
            assertEquals(SubmissionStatus.SUBMITTED, healthy.getStatus());
            assertEquals("bd-healthy", healthy.getExternalId());
            assertEquals(2, healthy.getAttempts());
            assertEquals(2, calls.get("healthy").get());
            assertEquals(5, report.getFailed().size());
            for (int i = 1; i <= 5; i++) {
                assertEquals(3, calls.get("broken-" + i).get());
                assertEquals(3, store.get("F-0000" + i).getAttempts());
            }
        }
    }

    @Test
    public void createdTaskIsNotSubmittedAgainWhenRecordingItFails() throws Exception {
        when(tracker.createTask(anyString(), anyString(), any(TaskPriority.class), anyList())).thenReturn("bd-42");
        AtomicBoolean diskFull = new AtomicBoolean(true);
        InMemorySubmissionStore flakyStore = new InMemorySubmissionStore() {
            @Override
            public synchronized void save(TaskSubmission submission) {
                if (submission.getStatus() == SubmissionStatus.SUBMITTED && diskFull.getAndSet(false)) {
                    throw new UncheckedIOException(new IOException("disk full"));
                }
                super.save(submission);
            }
        };
        try (TaskSinkAdapter sink = new TaskSinkAdapter(tracker, flakyStore, FAST_RETRIES, metrics)) {
            sink.enqueue(finding("F-00001", Severity.P1));

            SinkReport first = sink.flush();

            assertEquals(Collections.singletonList("bd-42"), first.getExternalIds());
            assertEquals(SubmissionStatus.PENDING, flakyStore.get("F-00001").getStatus());

            SinkReport second = sink.flush();

            verify(tracker, times(1)).createTask(anyString(), anyString(), any(TaskPriority.class), anyList());
            assertEquals(Collections.singletonList("bd-42"), second.getExternalIds());
            assertEquals(SubmissionStatus.SUBMITTED, flakyStore.get("F-00001").getStatus());
            assertEquals("bd-42", flakyStore.get("F-00001").getExternalId());
            assertTrue(sink.flush().getSubmissions().isEmpty());
        }
    }

    @Test
    public void enqueueSavesPendingSubmissionWithLabelsAndPriority() throws Exception {
        Finding finding = finding("F-00002", Severity.P1);

        TaskSubmission submission = adapter.enqueue(finding);

        verify(tracker, never()).createTask(anyString(), anyString(), any(TaskPriority.class), anyList());
        assertSame(submission, store.get("F-00002"));
        assertEquals(SubmissionStatus.PENDING, submission.getStatus());
        assertEquals(TaskPriority.HIGHEST, submission.getPriority());
        assertEquals(Arrays.asList("security", "analyzer:secrets", "code-review"), submission.getLabels());
        assertTrue(submission.getDescription().contains("Location: wrangler.toml:7"));
        assertTrue(submission.getDescription().contains("```\nTOKEN = \"abc\"\n```"));
        assertTrue(submission.getDescription().contains("Fingerprint: "));
        assertSame(submission, adapter.enqueue(finding));
    }

    @Test
    public void sendsSubmissionFieldsToTracker() throws Exception {
        when(tracker.createTask(anyString(), anyString(), any(TaskPriority.class), anyList())).thenReturn("bd-1");
        adapter.enqueue(finding("F-00003", Severity.P2));

        adapter.flush();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> labels = ArgumentCaptor.forClass(List.class);
        verify(tracker).createTask(eq("Secret in config F-00003"), anyString(), eq(TaskPriority.MEDIUM), labels.capture());
        assertTrue(labels.getValue().contains("analyzer:secrets"));
    }

    @Test
    public void resubmitRequiresFailedSubmission() {
        adapter.enqueue(finding("F-00005", Severity.P2));

        assertThrows(IllegalArgumentException.class, () -> adapter.resubmit("F-00005"));
        assertThrows(IllegalArgumentException.class, () -> adapter.resubmit("F-99999"));
    }

    @Test
    public void backoffDoublesUpToTheCap() {
        try (TaskSinkAdapter sink = new TaskSinkAdapter(tracker, store, SynthesisConfig.defaults(), metrics)) {
            assertEquals(1_000L, sink.backoffDelay(1));
            assertEquals(2_000L, sink.backoffDelay(2));
            assertEquals(4_000L, sink.backoffDelay(3));
            assertEquals(30_000L, sink.backoffDelay(10));
        }
    }

    @Test
    public void flushWithNothingPendingIsEmpty() {
        assertTrue(adapter.flush().getSubmissions().isEmpty());
    }

    private static Finding finding(String id, Severity severity) {
        return Finding.builder()
                .id(id)
                .sourceAnalyzer("secrets")
                .category(FindingCategory.SECURITY)
                .severity(severity)
                .location("wrangler.toml", LineRange.singleLine(7))
                .title("Secret in config " + id)
                .evidenceSnippets(Collections.singletonList("TOKEN = \"abc\""))
                .confidence(90)
                .build();
    }
}
