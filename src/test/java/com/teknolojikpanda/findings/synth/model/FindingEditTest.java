package com.teknolojikpanda.findings.synth.model;

import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FindingEditTest {

    private static final Finding FINDING = Finding.builder()
            .id("F-00003")
            .sourceAnalyzer("perf")
            .category(FindingCategory.PERFORMANCE)
            .severity(Severity.P2)
            .location("src/app.ts", LineRange.singleLine(5))
            .title("Synchronous crypto in handler")
            .description("Blocks the isolate.")
            .confidence(85)
            .build();

    @Test
    public void blankFieldsKeepCurrentValues() {
        FindingEdit edit = FindingEdit.builder().title("   ").description("").build();

        assertTrue(edit.isEmpty());
        assertEquals(FINDING, edit.applyTo(FINDING));
    }

    @Test
    public void appliesOnlyEditedFields() {
        FindingEdit edit = FindingEdit.builder()
                .severity(Severity.P1)
                .title("Synchronous crypto on hot path")
                .evidenceSnippets(Collections.singletonList("crypto.createHash('sha256')"))
                .build();

        Finding edited = edit.applyTo(FINDING);

        assertFalse(edit.isEmpty());
        assertEquals(Severity.P1, edited.getSeverity());
        assertEquals("Synchronous crypto on hot path", edited.getTitle());
        assertEquals("Blocks the isolate.", edited.getDescription());
        assertEquals(FindingCategory.PERFORMANCE, edited.getCategory());
        assertEquals("F-00003", edited.getId());
        assertEquals(85, edited.getConfidence());
        assertEquals(1, edited.getEvidenceSnippets().size());
    }
}
