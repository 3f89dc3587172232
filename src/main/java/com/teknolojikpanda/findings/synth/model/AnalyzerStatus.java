package com.teknolojikpanda.findings.synth.model;

/**
 * How an analyzer invocation ended.
 */
public enum AnalyzerStatus {
    COMPLETED,
    TIMED_OUT,
    FAILED
}
