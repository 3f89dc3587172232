package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.ConfidenceSignal;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.Severity;
import org.junit.Before;
import org.junit.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ConfidenceScorerTest {

    private ConfidenceScorer scorer;

    @Before
    public void setUp() {
        scorer = new ConfidenceScorer();
    }

    @Test
    public void allEvidenceWithoutFalsePositivesScoresEighty() {
        Set<ConfidenceSignal> signals = EnumSet.of(
                ConfidenceSignal.LOCATED,
                ConfidenceSignal.QUOTED_EXCERPT,
                ConfidenceSignal.CHANGED_CONTENT,
                ConfidenceSignal.DOCUMENTED_RULE);

        assertEquals(80, scorer.score(signals));
    }

    @Test
    public void falsePositivesOutweighingEvidenceClampToZero() {
        Set<ConfidenceSignal> signals = EnumSet.of(
                ConfidenceSignal.LOCATED,
                ConfidenceSignal.STYLE_PREFERENCE,
                ConfidenceSignal.DETERMINISTIC_CHECK);

        assertEquals(0, scorer.score(signals));
    }

    @Test
    public void eachFalsePositiveSubtractsTwenty() {
        Set<ConfidenceSignal> signals = EnumSet.of(
                ConfidenceSignal.LOCATED,
                ConfidenceSignal.QUOTED_EXCERPT,
                ConfidenceSignal.CHANGED_CONTENT,
                ConfidenceSignal.DOCUMENTED_RULE,
                ConfidenceSignal.SUPPRESSED);

        assertEquals(60, scorer.score(signals));
        assertEquals(0, scorer.score(EnumSet.noneOf(ConfidenceSignal.class)));
    }

    @Test
    public void corroborationIsAddedAfterClampingAndCappedAtHundred() {
        assertEquals(90, scorer.withCorroboration(80, 1));
        assertEquals(100, scorer.withCorroboration(90, 3));
        assertEquals(10, scorer.withCorroboration(0, 1));
        assertThrows(IllegalArgumentException.class, () -> scorer.withCorroboration(50, -1));
    }

    @Test
    public void scoreIsDeterministicAndBoundedForEverySignalCombination() {
        ConfidenceSignal[] all = ConfidenceSignal.values();
        for (int mask = 0; mask < (1 << all.length); mask++) {
            EnumSet<ConfidenceSignal> signals = EnumSet.noneOf(ConfidenceSignal.class);
            for (int bit = 0; bit < all.length; bit++) {
                if ((mask & (1 << bit)) != 0) {
                    signals.add(all[bit]);
                }
            }
            int first = scorer.score(signals);
            int second = scorer.score(signals.clone());
            assertEquals("same signals must score the same: " + signals, first, second);
            assertTrue(first >= 0 && first <= 100);
            for (int corroborations = 0; corroborations < 12; corroborations++) {
                int total = scorer.withCorroboration(first, corroborations);
                assertTrue(total >= 0 && total <= 100);
            }
        }
    }

    @Test
    public void scoringAFindingUsesItsSignalsAndCorroborations() {
        Finding finding = Finding.builder()
                .id("F-00001")
                .sourceAnalyzer("security")
                .category(FindingCategory.SECURITY)
                .severity(Severity.P1)
                .title("Hardcoded token")
                .rawConfidenceSignals(EnumSet.of(ConfidenceSignal.LOCATED, ConfidenceSignal.QUOTED_EXCERPT))
                .corroborations(2)
                .build();
        assertFalse(finding.isScored());

        Finding scored = scorer.score(finding);

        assertEquals(60, scored.getConfidence());
        assertEquals(scored.getConfidence(), scorer.recompute(scored));
        assertEquals(finding.getId(), scored.getId());
    }
}
