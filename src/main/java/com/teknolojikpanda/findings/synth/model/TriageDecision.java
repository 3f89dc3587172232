package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Terminal decision recorded for one finding.
 */
public final class TriageDecision {

    private final String findingId;
    private final TriageOutcome outcome;
    private final Finding editedFinding;

    private TriageDecision(String findingId, TriageOutcome outcome, Finding editedFinding) {
        this.findingId = Objects.requireNonNull(findingId, "findingId");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        if ((outcome == TriageOutcome.EDITED) != (editedFinding != null)) {
            throw new IllegalArgumentException("editedFinding must be present exactly when the outcome is EDITED");
        }
        if (editedFinding != null && !editedFinding.getId().equals(findingId)) {
            throw new IllegalArgumentException("editedFinding id " + editedFinding.getId() + " does not match " + findingId);
        }
        this.editedFinding = editedFinding;
    }

    public static TriageDecision accepted(@Nonnull String findingId) {
        return new TriageDecision(findingId, TriageOutcome.ACCEPTED, null);
    }

    public static TriageDecision skipped(@Nonnull String findingId) {
        return new TriageDecision(findingId, TriageOutcome.SKIPPED, null);
    }

    public static TriageDecision edited(@Nonnull Finding editedFinding) {
        Objects.requireNonNull(editedFinding, "editedFinding");
        return new TriageDecision(editedFinding.getId(), TriageOutcome.EDITED, editedFinding);
    }

    @Nonnull
    public String getFindingId() {
        return findingId;
    }

    @Nonnull
    public TriageOutcome getOutcome() {
        return outcome;
    }

    @Nullable
    public Finding getEditedFinding() {
        return editedFinding;
    }

    @Override
    public String toString() {
        return findingId + "=" + outcome;
    }
}
