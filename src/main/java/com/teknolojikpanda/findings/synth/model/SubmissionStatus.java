package com.teknolojikpanda.findings.synth.model;

/**
 * Lifecycle of a tracker submission. {@link #FAILED} submissions are kept for manual resubmission.
 */
public enum SubmissionStatus {
    PENDING,
    SUBMITTED,
    FAILED
}
