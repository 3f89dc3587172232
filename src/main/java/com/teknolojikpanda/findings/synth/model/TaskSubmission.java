package com.teknolojikpanda.findings.synth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A task the tracker has been, or still has to be, asked to create for an accepted finding.
 * Self-contained so a stored submission can be retried without the originating finding.
 */
public final class TaskSubmission {

    private final String findingId;
    private final String title;
    private final String description;
    private final TaskPriority priority;
    private final List<String> labels;
    private final String externalId;
    private final int attempts;
    private final String lastError;
    private final SubmissionStatus status;

    @JsonCreator
    public TaskSubmission(@JsonProperty("findingId") String findingId,
                          @JsonProperty("title") String title,
                          @JsonProperty("description") String description,
                          @JsonProperty("priority") TaskPriority priority,
                          @JsonProperty("labels") List<String> labels,
                          @JsonProperty("externalId") String externalId,
                          @JsonProperty("attempts") int attempts,
                          @JsonProperty("lastError") String lastError,
                          @JsonProperty("status") SubmissionStatus status) {
        this.findingId = Objects.requireNonNull(findingId, "findingId");
        this.title = Objects.requireNonNull(title, "title");
        this.description = description != null ? description : "";
        this.priority = Objects.requireNonNull(priority, "priority");
        this.labels = labels == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(labels));
        this.externalId = externalId;
        this.attempts = attempts;
        this.lastError = lastError;
        this.status = status != null ? status : SubmissionStatus.PENDING;
    }

    /**
     * New pending submission with no attempts.
     */
    public static TaskSubmission pending(@Nonnull String findingId,
                                         @Nonnull String title,
                                         @Nonnull String description,
                                         @Nonnull TaskPriority priority,
                                         @Nonnull List<String> labels) {
        return new TaskSubmission(findingId, title, description, priority, labels, null, 0, null, SubmissionStatus.PENDING);
    }

    @JsonProperty
    @Nonnull
    public String getFindingId() {
        return findingId;
    }

    @JsonProperty
    @Nonnull
    public String getTitle() {
        return title;
    }

    @JsonProperty
    @Nonnull
    public String getDescription() {
        return description;
    }

    @JsonProperty
    @Nonnull
    public TaskPriority getPriority() {
        return priority;
    }

    @JsonProperty
    @Nonnull
    public List<String> getLabels() {
        return labels;
    }

    /**
     * @return tracker id, {@code null} until the tracker confirms creation
     */
    @JsonProperty
    @Nullable
    public String getExternalId() {
        return externalId;
    }

    @JsonProperty
    public int getAttempts() {
        return attempts;
    }

    @JsonProperty
    @Nullable
    public String getLastError() {
        return lastError;
    }

    @JsonProperty
    @Nonnull
    public SubmissionStatus getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isSubmitted() {
        return status == SubmissionStatus.SUBMITTED;
    }

    @Nonnull
    public TaskSubmission withSuccess(@Nonnull String createdId) {
        Objects.requireNonNull(createdId, "createdId");
        return new TaskSubmission(findingId, title, description, priority, labels, createdId,
                attempts + 1, lastError, SubmissionStatus.SUBMITTED);
    }

    @Nonnull
    public TaskSubmission withFailure(@Nonnull String error, boolean exhausted) {
        return new TaskSubmission(findingId, title, description, priority, labels, null,
                attempts + 1, error, exhausted ? SubmissionStatus.FAILED : SubmissionStatus.PENDING);
    }

    /**
     * Puts a failed submission back in the queue with a fresh attempt budget. The last error is kept.
     */
    @Nonnull
    public TaskSubmission reopened() {
        return new TaskSubmission(findingId, title, description, priority, labels, null,
                0, lastError, SubmissionStatus.PENDING);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskSubmission)) return false;
        TaskSubmission that = (TaskSubmission) o;
        return attempts == that.attempts
                && findingId.equals(that.findingId)
                && title.equals(that.title)
                && description.equals(that.description)
                && priority == that.priority
                && labels.equals(that.labels)
                && Objects.equals(externalId, that.externalId)
                && Objects.equals(lastError, that.lastError)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(findingId, title, description, priority, labels, externalId, attempts, lastError, status);
    }

    @Override
    public String toString() {
        return "TaskSubmission{" + findingId
                + ", status=" + status
                + ", attempts=" + attempts
                + (externalId != null ? ", externalId=" + externalId : "")
                + (lastError != null ? ", lastError='" + lastError + "'" : "")
                + "}";
    }
}
