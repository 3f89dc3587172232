package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.AnalyzerResult;

import javax.annotation.Nonnull;

/**
 * Listener invoked when analyzer execution state changes inside the gatherer.
 */
public interface AnalyzerProgressListener {

    /**
     * Called on the analyzer's worker thread immediately before it runs.
     *
     * @param analyzerId active analyzer
     * @param index      zero-based analyzer index
     * @param total      number of analyzers scheduled for the run
     */
    default void onAnalyzerStarted(@Nonnull String analyzerId, int index, int total) {
        // no-op
    }

    /**
     * Called on the joining thread once the analyzer's outcome is known (completed, failed or
     * timed out).
     */
    default void onAnalyzerCompleted(@Nonnull AnalyzerResult result, int index, int total) {
        // no-op
    }
}
