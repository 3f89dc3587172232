package com.teknolojikpanda.findings.triage.sink;

import com.teknolojikpanda.findings.synth.api.SubmissionStore;
import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Process-local store used when no submission file is configured. Keeps insertion order.
 */
public class InMemorySubmissionStore implements SubmissionStore {

    private final Map<String, TaskSubmission> submissions = new LinkedHashMap<>();

    @Override
    public synchronized void save(@Nonnull TaskSubmission submission) {
        Objects.requireNonNull(submission, "submission");
        submissions.put(submission.getFindingId(), submission);
    }

    @Nullable
    @Override
    public synchronized TaskSubmission get(@Nonnull String findingId) {
        return submissions.get(findingId);
    }

    @Nonnull
    @Override
    public synchronized List<TaskSubmission> findAll() {
        return new ArrayList<>(submissions.values());
    }

    @Nonnull
    @Override
    public synchronized List<TaskSubmission> findByStatus(@Nonnull SubmissionStatus status) {
        return submissions.values().stream()
                .filter(submission -> submission.getStatus() == status)
                .collect(Collectors.toList());
    }
}
