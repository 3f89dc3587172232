package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.ConfidenceSignal;
import com.teknolojikpanda.findings.synth.model.Finding;

import javax.annotation.Nonnull;
import javax.inject.Named;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Point-based trust model. Each evidence signal adds {@value #EVIDENCE_POINTS} (at most
 * {@value #MAX_EVIDENCE_SIGNALS} counted), each false-positive indicator subtracts
 * {@value #FALSE_POSITIVE_PENALTY}, and the total is clamped to [0, 100]. Corroboration adds
 * {@value #CORROBORATION_BONUS} per corroborating finding on top of the clamped base, capped at 100.
 * <p>
 * Every method is a pure function of its arguments.
 */
@Named
public class ConfidenceScorer {

    public static final int EVIDENCE_POINTS = 20;
    public static final int MAX_EVIDENCE_SIGNALS = 4;
    public static final int FALSE_POSITIVE_PENALTY = 20;
    public static final int CORROBORATION_BONUS = 10;
    public static final int MIN_CONFIDENCE = 0;
    public static final int MAX_CONFIDENCE = 100;

    /**
     * Base score before corroboration.
     */
    public int score(@Nonnull Set<ConfidenceSignal> signals) {
        Objects.requireNonNull(signals, "signals");
        int evidence = 0;
        int falsePositives = 0;
        for (ConfidenceSignal signal : signals) {
            if (signal.isEvidence()) {
                evidence++;
            } else {
                falsePositives++;
            }
        }
        int total = Math.min(evidence, MAX_EVIDENCE_SIGNALS) * EVIDENCE_POINTS
                - falsePositives * FALSE_POSITIVE_PENALTY;
        return clamp(total);
    }

    public int withCorroboration(int base, int corroborations) {
        if (corroborations < 0) {
            throw new IllegalArgumentException("corroborations must be >= 0");
        }
        return Math.min(MAX_CONFIDENCE, clamp(base) + CORROBORATION_BONUS * corroborations);
    }

    /**
     * Confidence the finding must carry given its signals and corroboration count.
     */
    public int recompute(@Nonnull Finding finding) {
        return withCorroboration(score(finding.getRawConfidenceSignals()), finding.getCorroborations());
    }

    @Nonnull
    public Finding score(@Nonnull Finding finding) {
        Objects.requireNonNull(finding, "finding");
        return finding.toBuilder().confidence(recompute(finding)).build();
    }

    @Nonnull
    public List<Finding> scoreAll(@Nonnull List<Finding> findings) {
        List<Finding> scored = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            scored.add(score(finding));
        }
        return scored;
    }

    private static int clamp(int value) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, value));
    }
}
