package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.Severity;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ThresholdFilterTest {

    private final ThresholdFilter filter = new ThresholdFilter();

    @Test
    public void keepsFindingsAtOrAboveThreshold() {
        List<Finding> findings = Arrays.asList(finding("F-00001", 79, false), finding("F-00002", 80, false),
                finding("F-00003", 95, false));

        List<Finding> kept = filter.filter(findings, 80);

        assertEquals(2, kept.size());
        assertEquals("F-00002", kept.get(0).getId());
    }

    @Test
    public void conflictsSurviveAnyThreshold() {
        Finding conflict = finding("F-00001", 30, true);

        for (int threshold = 0; threshold <= 100; threshold++) {
            assertTrue(filter.keeps(conflict, threshold));
        }
    }

    @Test
    public void raisingTheThresholdNeverAddsFindings() {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i <= 20; i++) {
            findings.add(finding(String.format("F-%05d", i + 1), i * 5, i % 7 == 0));
        }

        List<Finding> previous = filter.filter(findings, 0);
        for (int threshold = 1; threshold <= 100; threshold++) {
            List<Finding> current = filter.filter(findings, threshold);
            assertTrue(current.size() <= previous.size());
            assertTrue(previous.containsAll(current));
            previous = current;
        }
    }

    private static Finding finding(String id, int confidence, boolean conflict) {
        return Finding.builder()
                .id(id)
                .sourceAnalyzer("perf")
                .category(FindingCategory.PERFORMANCE)
                .severity(Severity.P2)
                .title("Slow path " + id)
                .confidence(confidence)
                .conflict(conflict)
                .build();
    }
}
