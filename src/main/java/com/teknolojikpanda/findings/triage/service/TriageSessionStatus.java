package com.teknolojikpanda.findings.triage.service;

/**
 * Session-level state. {@code CANCELLED} is resumable; {@code COMPLETED} is final.
 */
public enum TriageSessionStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
