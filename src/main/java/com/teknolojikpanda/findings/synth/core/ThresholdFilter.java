package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;

import javax.annotation.Nonnull;
import javax.inject.Named;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Drops findings below the confidence threshold. Conflicts always pass.
 */
@Named
public class ThresholdFilter {

    public boolean keeps(@Nonnull Finding finding, int threshold) {
        return finding.isConflict() || finding.getConfidence() >= threshold;
    }

    @Nonnull
    public List<Finding> filter(@Nonnull List<Finding> findings, int threshold) {
        Objects.requireNonNull(findings, "findings");
        return findings.stream()
                .filter(finding -> keeps(finding, threshold))
                .collect(Collectors.toList());
    }
}
