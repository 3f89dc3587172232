package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.AnalyzerResult;
import com.teknolojikpanda.findings.synth.model.AnalyzerResults;
import com.teknolojikpanda.findings.synth.model.ConfidenceSignal;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.IngestionResult;
import com.teknolojikpanda.findings.synth.model.LineRange;
import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.Severity;
import com.teknolojikpanda.findings.synth.model.ValidationError;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FindingIngestorTest {

    private FindingIngestor ingestor;

    @Before
    public void setUp() {
        ingestor = new FindingIngestor();
    }

    @Test
    public void normalizesValidPayloadAndDerivesStructuralSignals() {
        RawFinding payload = RawFinding.builder()
                .title("  SQL built from request parameters ")
                .category("security")
                .severity("p1")
                .location("src/db/query.ts", 42)
                .locationEndLine(44)
                .description("User input reaches the query string.")
                .addEvidence("db.prepare(`SELECT * FROM users WHERE id = ${id}`)")
                .signal("changedContent", true)
                .signal("style-preference", "yes")
                .signal("suppressionMarker", 0)
                .signal("locationPresent", false)
                .signal("somethingElse", true)
                .build();

        IngestionResult result = ingestor.ingest("security", Collections.singletonList(payload));

        assertFalse(result.hasErrors());
        Finding finding = result.getFindings().get(0);
        assertEquals("F-00001", finding.getId());
        assertEquals("security", finding.getSourceAnalyzer());
        assertEquals(FindingCategory.SECURITY, finding.getCategory());
        assertEquals(Severity.P1, finding.getSeverity());
        assertEquals("src/db/query.ts", finding.getLocationFile());
        assertEquals(LineRange.of(42, 44), finding.getLineRange());
        assertEquals("SQL built from request parameters", finding.getTitle());
        assertFalse(finding.isScored());
        assertEquals(EnumSet.of(
                ConfidenceSignal.LOCATED,
                ConfidenceSignal.QUOTED_EXCERPT,
                ConfidenceSignal.CHANGED_CONTENT,
                ConfidenceSignal.STYLE_PREFERENCE), finding.getRawConfidenceSignals());
    }

    @Test
    public void malformedPayloadsAreReportedWithoutAbortingTheBatch() {
        List<RawFinding> payloads = Arrays.asList(
                valid("first"),
                RawFinding.builder().category("performance").severity("P2").build(),
                RawFinding.builder().title("no category").severity("P2").build(),
                RawFinding.builder().title("bad severity").category("design").severity("P4").build(),
                null,
                valid("last"));

        IngestionResult result = ingestor.ingest("perf", payloads);

        assertEquals(Arrays.asList("F-00001", "F-00002"),
                result.getFindings().stream().map(Finding::getId).collect(Collectors.toList()));
        assertEquals(Arrays.asList("first", "last"),
                result.getFindings().stream().map(Finding::getTitle).collect(Collectors.toList()));
        List<String> fields = result.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList());
        assertEquals(Arrays.asList("title", "category", "severity", "payload"), fields);
        assertEquals(1, result.getErrors().get(0).getPayloadIndex());
        assertEquals(4, result.getErrors().get(3).getPayloadIndex());
        assertTrue(result.getErrors().get(2).getMessage().contains("P4"));
    }

    @Test
    public void rejectsLineWithoutFileAndNonPositiveLines() {
        List<RawFinding> payloads = Arrays.asList(
                RawFinding.builder().title("orphan line").category("quality").severity("P3").locationLine(5).build(),
                RawFinding.builder().title("line zero").category("quality").severity("P3").location("a.ts", 0).build(),
                RawFinding.builder().title("backwards").category("quality").severity("P3")
                        .location("a.ts", 9).locationEndLine(3).build());

        IngestionResult result = ingestor.ingest("quality", payloads);

        assertTrue(result.getFindings().isEmpty());
        assertEquals(Arrays.asList("location.file", "location.line", "location.endLine"),
                result.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList()));
    }

    @Test
    public void fileLevelAndRepoWideFindingsHaveNoLocatedSignal() {
        List<RawFinding> payloads = Arrays.asList(
                RawFinding.builder().title("file level").category("docs").severity("P3").locationFile("README.md").build(),
                RawFinding.builder().title("repo wide").category("testing").severity("P2").build());

        List<Finding> findings = ingestor.ingest("docs", payloads).getFindings();

        assertEquals("README.md", findings.get(0).getLocationFile());
        assertNull(findings.get(0).getLineRange());
        assertFalse(findings.get(0).hasSignal(ConfidenceSignal.LOCATED));
        assertTrue(findings.get(1).isRepoWide());
        assertTrue(findings.get(1).getRawConfidenceSignals().isEmpty());
    }

    @Test
    public void idsFollowAnalyzerOrderThenPayloadOrder() {
        AnalyzerResults results = new AnalyzerResults(Arrays.asList(
                AnalyzerResult.completed("a", Arrays.asList(valid("a1"), valid("a2")), Duration.ZERO),
                AnalyzerResult.timedOut("b", Duration.ofMillis(10)),
                AnalyzerResult.completed("c", Collections.singletonList(valid("c1")), Duration.ZERO)));

        IngestionResult result = ingestor.ingest(results);

        assertEquals(Arrays.asList("F-00001:a1", "F-00002:a2", "F-00003:c1"),
                result.getFindings().stream()
                        .map(f -> f.getId() + ":" + f.getTitle())
                        .collect(Collectors.toList()));
    }

    @Test
    public void declaredSignalValuesFollowPresenceRules() {
        assertTrue(FindingIngestor.isPresent(true));
        assertTrue(FindingIngestor.isPresent(1));
        assertTrue(FindingIngestor.isPresent(0.5));
        assertTrue(FindingIngestor.isPresent(" YES "));
        assertFalse(FindingIngestor.isPresent(false));
        assertFalse(FindingIngestor.isPresent(0));
        assertFalse(FindingIngestor.isPresent("no"));
        assertFalse(FindingIngestor.isPresent(null));
    }

    private static RawFinding valid(String title) {
        return RawFinding.builder()
                .title(title)
                .category("performance")
                .severity("P2")
                .location("src/app.ts", 10)
                .build();
    }
}
