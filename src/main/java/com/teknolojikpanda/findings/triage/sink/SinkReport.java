package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one flush. Failed submissions stay in the store and can be resubmitted.
 */
public final class SinkReport {

    private final List<TaskSubmission> submissions;

    public SinkReport(@Nonnull List<TaskSubmission> submissions) {
        this.submissions = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(submissions, "submissions")));
    }

    public static SinkReport empty() {
        return new SinkReport(Collections.emptyList());
    }

    /**
     * Combines two reports; for a finding present in both, the entry from {@code later} wins.
     */
    @Nonnull
    public SinkReport plus(@Nonnull SinkReport later) {
        Map<String, TaskSubmission> merged = new LinkedHashMap<>();
        for (TaskSubmission submission : submissions) {
            merged.put(submission.getFindingId(), submission);
        }
        for (TaskSubmission submission : later.submissions) {
            merged.put(submission.getFindingId(), submission);
        }
        return new SinkReport(new ArrayList<>(merged.values()));
    }

    /**
     * Every submission this flush handled, in the order it was attempted.
     */
    @Nonnull
    public List<TaskSubmission> getSubmissions() {
        return submissions;
    }

    @Nonnull
    public List<TaskSubmission> getSubmitted() {
        return withStatus(SubmissionStatus.SUBMITTED);
    }

    @Nonnull
    public List<TaskSubmission> getFailed() {
        return withStatus(SubmissionStatus.FAILED);
    }

    /**
     * Submissions left pending, e.g. when the flush was interrupted.
     */
    @Nonnull
    public List<TaskSubmission> getPending() {
        return withStatus(SubmissionStatus.PENDING);
    }

    @Nonnull
    public List<String> getExternalIds() {
        return getSubmitted().stream().map(TaskSubmission::getExternalId).collect(Collectors.toList());
    }

    public int getTotalAttempts() {
        return submissions.stream().mapToInt(TaskSubmission::getAttempts).sum();
    }

    public boolean isComplete() {
        return submissions.stream().allMatch(TaskSubmission::isSubmitted);
    }

    private List<TaskSubmission> withStatus(SubmissionStatus status) {
        return submissions.stream().filter(s -> s.getStatus() == status).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "SinkReport{submitted=" + getSubmitted().size()
                + ", failed=" + getFailed().size()
                + ", pending=" + getPending().size() + "}";
    }
}
