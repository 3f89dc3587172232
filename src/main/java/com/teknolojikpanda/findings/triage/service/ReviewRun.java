package com.teknolojikpanda.findings.triage.service;

import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.SynthesisResult;
import com.teknolojikpanda.findings.triage.sink.SinkReport;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * State of one review: the synthesized findings, the triage session (possibly cancelled and
 * resumable), the latest sink report and the transcript built from them.
 */
public final class ReviewRun {

    private final ReviewTarget target;
    private final SynthesisResult synthesis;
    private final TriageSession session;
    private final SinkReport sinkReport;
    private final TriageTranscript transcript;

    ReviewRun(@Nonnull ReviewTarget target,
              @Nonnull SynthesisResult synthesis,
              @Nonnull TriageSession session,
              @Nonnull SinkReport sinkReport) {
        this.target = Objects.requireNonNull(target, "target");
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis");
        this.session = Objects.requireNonNull(session, "session");
        this.sinkReport = Objects.requireNonNull(sinkReport, "sinkReport");
        this.transcript = TriageTranscript.of(target.getReference(), synthesis, session, sinkReport);
    }

    @Nonnull
    public ReviewTarget getTarget() {
        return target;
    }

    @Nonnull
    public SynthesisResult getSynthesis() {
        return synthesis;
    }

    @Nonnull
    public TriageSession getSession() {
        return session;
    }

    @Nonnull
    public SinkReport getSinkReport() {
        return sinkReport;
    }

    @Nonnull
    public TriageTranscript getTranscript() {
        return transcript;
    }

    public boolean isComplete() {
        return session.isComplete();
    }
}
