package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.FindingPresentation;
import com.teknolojikpanda.findings.synth.model.TriageResponse;

import javax.annotation.Nonnull;

/**
 * Supplies the reviewer's answer for a presented finding. May block indefinitely; implementations
 * range from an interactive terminal to scripted test harnesses.
 */
public interface DecisionProvider {

    /**
     * @throws TriageCanceledException when the reviewer wants to stop the session
     */
    @Nonnull
    TriageResponse decide(@Nonnull FindingPresentation presentation);
}
