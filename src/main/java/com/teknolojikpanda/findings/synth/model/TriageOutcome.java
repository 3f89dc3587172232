package com.teknolojikpanda.findings.synth.model;

/**
 * Terminal triage outcomes. {@link #EDITED} means the finding was modified and then accepted.
 */
public enum TriageOutcome {
    ACCEPTED,
    SKIPPED,
    EDITED;

    /**
     * Whether the decision turns the finding into a tracked task.
     */
    public boolean createsTask() {
        return this != SKIPPED;
    }
}
