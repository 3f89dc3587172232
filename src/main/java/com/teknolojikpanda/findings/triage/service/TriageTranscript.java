package com.teknolojikpanda.findings.triage.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.teknolojikpanda.findings.synth.model.AnalyzerStatus;
import com.teknolojikpanda.findings.synth.model.SynthesisResult;
import com.teknolojikpanda.findings.synth.model.TaskSubmission;
import com.teknolojikpanda.findings.synth.model.TriageOutcome;
import com.teknolojikpanda.findings.triage.sink.SinkReport;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured summary emitted when a triage session ends, completed or not.
 */
@JsonPropertyOrder({"sessionId", "target", "incomplete", "totalIngested", "threshold", "survivingThreshold",
        "confidenceDistribution", "accepted", "skipped", "edited", "undecided", "externalIds",
        "failedSubmissions", "validationErrors", "conflicts", "timedOutAnalyzers", "failedAnalyzers",
        "startTime", "endTime"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TriageTranscript {

    private final String sessionId;
    private final String target;
    private final boolean incomplete;
    private final int totalIngested;
    private final int threshold;
    private final int survivingThreshold;
    private final Map<String, Integer> confidenceDistribution;
    private final int accepted;
    private final int skipped;
    private final int edited;
    private final int undecided;
    private final List<String> externalIds;
    private final List<String> failedSubmissions;
    private final int validationErrors;
    private final int conflicts;
    private final List<String> timedOutAnalyzers;
    private final List<String> failedAnalyzers;
    private final String startTime;
    private final String endTime;

    private TriageTranscript(String target, SynthesisResult synthesis, TriageSession session, SinkReport sinkReport) {
        this.sessionId = session.getSessionId();
        this.target = target;
        this.incomplete = !session.isComplete();
        this.totalIngested = synthesis.getIngestedCount();
        this.threshold = synthesis.getThreshold();
        this.survivingThreshold = synthesis.getQueue().size();
        this.confidenceDistribution = Collections.unmodifiableMap(
                new LinkedHashMap<>(synthesis.getDistribution().asMap()));
        this.accepted = session.getCount(TriageOutcome.ACCEPTED);
        this.skipped = session.getCount(TriageOutcome.SKIPPED);
        this.edited = session.getCount(TriageOutcome.EDITED);
        this.undecided = session.getUndecided().size();
        this.externalIds = Collections.unmodifiableList(new ArrayList<>(sinkReport.getExternalIds()));
        this.failedSubmissions = Collections.unmodifiableList(sinkReport.getFailed().stream()
                .map(TaskSubmission::getFindingId)
                .collect(Collectors.toList()));
        this.validationErrors = synthesis.getIngestion().getErrors().size();
        this.conflicts = synthesis.getConflictCount();
        this.timedOutAnalyzers = synthesis.getAnalyzerResults().idsWithStatus(AnalyzerStatus.TIMED_OUT);
        this.failedAnalyzers = synthesis.getAnalyzerResults().idsWithStatus(AnalyzerStatus.FAILED);
        this.startTime = session.getStartTime() != null ? session.getStartTime().toString() : null;
        this.endTime = session.getEndTime() != null ? session.getEndTime().toString() : null;
    }

    @Nonnull
    public static TriageTranscript of(@Nonnull String target,
                                      @Nonnull SynthesisResult synthesis,
                                      @Nonnull TriageSession session,
                                      @Nonnull SinkReport sinkReport) {
        return new TriageTranscript(Objects.requireNonNull(target, "target"),
                Objects.requireNonNull(synthesis, "synthesis"),
                Objects.requireNonNull(session, "session"),
                Objects.requireNonNull(sinkReport, "sinkReport"));
    }

    @JsonProperty
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty
    public String getTarget() {
        return target;
    }

    /**
     * True when the session was cancelled before every finding had a decision.
     */
    @JsonProperty
    public boolean isIncomplete() {
        return incomplete;
    }

    @JsonProperty
    public int getTotalIngested() {
        return totalIngested;
    }

    @JsonProperty
    public int getThreshold() {
        return threshold;
    }

    @JsonProperty
    public int getSurvivingThreshold() {
        return survivingThreshold;
    }

    /**
     * Bucket label ({@code 90-100}, {@code 80-89}, {@code <80}) to count over the merged findings.
     */
    @JsonProperty
    public Map<String, Integer> getConfidenceDistribution() {
        return confidenceDistribution;
    }

    @JsonProperty
    public int getAccepted() {
        return accepted;
    }

    @JsonProperty
    public int getSkipped() {
        return skipped;
    }

    @JsonProperty
    public int getEdited() {
        return edited;
    }

    @JsonProperty
    public int getUndecided() {
        return undecided;
    }

    @JsonProperty
    public List<String> getExternalIds() {
        return externalIds;
    }

    @JsonProperty
    public List<String> getFailedSubmissions() {
        return failedSubmissions;
    }

    @JsonProperty
    public int getValidationErrors() {
        return validationErrors;
    }

    @JsonProperty
    public int getConflicts() {
        return conflicts;
    }

    @JsonProperty
    public List<String> getTimedOutAnalyzers() {
        return timedOutAnalyzers;
    }

    @JsonProperty
    public List<String> getFailedAnalyzers() {
        return failedAnalyzers;
    }

    @Nullable
    @JsonProperty
    public String getStartTime() {
        return startTime;
    }

    @Nullable
    @JsonProperty
    public String getEndTime() {
        return endTime;
    }

    @Nonnull
    public String toJson(@Nonnull ObjectMapper objectMapper) throws JsonProcessingException {
        return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(this);
    }

    public void writeTo(@Nonnull Path file, @Nonnull ObjectMapper objectMapper) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), this);
    }

    @Override
    public String toString() {
        return "TriageTranscript{" + sessionId
                + ", incomplete=" + incomplete
                + ", ingested=" + totalIngested
                + ", surviving=" + survivingThreshold
                + ", accepted=" + accepted
                + ", skipped=" + skipped
                + ", edited=" + edited
                + ", externalIds=" + externalIds + "}";
    }
}
