package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.SubmissionStatus;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Durable record of tracker submissions, keyed by finding id. A submission is saved before its
 * first attempt and after every attempt, so nothing accepted is lost if the process stops.
 */
public interface SubmissionStore {

    /**
     * Inserts or replaces the submission for its finding id.
     */
    void save(@Nonnull TaskSubmission submission);

    @Nullable
    TaskSubmission get(@Nonnull String findingId);

    @Nonnull
    List<TaskSubmission> findAll();

    @Nonnull
    List<TaskSubmission> findByStatus(@Nonnull SubmissionStatus status);
}
