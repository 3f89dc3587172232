package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;

import javax.annotation.Nonnull;
import javax.inject.Named;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Triage order: severity (P1 first), then confidence descending, then id ascending.
 */
@Named
public class PrioritySorter {

    public static final Comparator<Finding> TRIAGE_ORDER = Comparator
            .comparingInt((Finding finding) -> finding.getSeverity().rank())
            .thenComparing(Comparator.comparingInt(Finding::getConfidence).reversed())
            .thenComparing(Finding::getId);

    @Nonnull
    public List<Finding> sort(@Nonnull List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(TRIAGE_ORDER);
        return sorted;
    }
}
