package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingPresentation;
import com.teknolojikpanda.findings.synth.model.TriageDecision;

import javax.annotation.Nonnull;

/**
 * Listener invoked as the triage session moves findings through their states.
 */
public interface TriageListener {

    default void onPresented(@Nonnull FindingPresentation presentation) {
        // no-op
    }

    /**
     * Called after an edit was applied and before the modified finding is presented again.
     */
    default void onEdited(@Nonnull Finding before, @Nonnull Finding after) {
        // no-op
    }

    /**
     * Called with a finding's terminal decision before the session records it. For accepted and
     * edited outcomes {@code finding} is the version that should become a task. Throwing leaves the
     * finding undecided, so it is presented again when the session resumes.
     */
    default void onDecided(@Nonnull TriageDecision decision, @Nonnull Finding finding) {
        // no-op
    }
}
