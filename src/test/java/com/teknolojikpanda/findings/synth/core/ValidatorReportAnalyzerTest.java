package com.teknolojikpanda.findings.synth.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teknolojikpanda.findings.synth.model.AnalyzerResult;
import com.teknolojikpanda.findings.synth.model.AnalyzerResults;
import com.teknolojikpanda.findings.synth.model.ConfidenceSignal;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.Severity;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ValidatorReportAnalyzerTest {

    private static final ReviewTarget TARGET = ReviewTarget.of("HEAD");

    private static final String REPORT = "{\n"
            + "  \"violations\": [\n"
            + "    {\"file\": \"wrangler.toml\", \"line\": 7, \"severity\": \"critical\",\n"
            + "     \"type\": \"hardcoded-secret\", \"message\": \"API token committed\",\n"
            + "     \"code\": \"TOKEN = \\\"abc\\\"\", \"fix\": \"Use wrangler secret put\"},\n"
            + "    {\"file\": \"wrangler.toml\", \"line\": 0, \"severity\": \"warning\",\n"
            + "     \"message\": \"compatibility_date is older than a year\", \"context\": \"2022-01-01\"},\n"
            + "    {\"file\": \"src/index.ts\", \"line\": 3, \"severity\": \"bogus\", \"message\": \"odd\"}\n"
            + "  ]\n"
            + "}";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void mapsViolationsToPayloads() throws Exception {
        ValidatorReportAnalyzer analyzer = new ValidatorReportAnalyzer("secrets", FindingCategory.SECURITY,
                target -> REPORT, new ObjectMapper());

        List<RawFinding> payloads = analyzer.analyze(TARGET);

        assertEquals(3, payloads.size());
        RawFinding secret = payloads.get(0);
        assertEquals("API token committed", secret.getTitle());
        assertEquals("security", secret.getCategory());
        assertEquals("P1", secret.getSeverity());
        assertEquals(Integer.valueOf(7), secret.getLocationLine());
        assertEquals("Rule: hardcoded-secret\nFix: Use wrangler secret put", secret.getDescription());
        assertEquals(Collections.singletonList("TOKEN = \"abc\""), secret.getEvidenceSnippets());
        assertEquals(Boolean.TRUE, secret.getRawConfidenceSignals().get("documentedRule"));

        RawFinding fileLevel = payloads.get(1);
        assertEquals("P2", fileLevel.getSeverity());
        assertNull(fileLevel.getLocationLine());
        assertEquals("2022-01-01", fileLevel.getDescription());
    }

    @Test
    public void unknownSeverityIsRejectedAtIngestion() throws Exception {
        ValidatorReportAnalyzer analyzer = new ValidatorReportAnalyzer("secrets", FindingCategory.SECURITY,
                target -> REPORT, new ObjectMapper());
        AnalyzerResults results = new AnalyzerResults(Collections.singletonList(
                AnalyzerResult.completed("secrets", analyzer.analyze(TARGET), Duration.ZERO)));

        List<Finding> findings = new FindingIngestor().ingest(results).getFindings();

        assertEquals(2, findings.size());
        assertEquals(Severity.P1, findings.get(0).getSeverity());
        assertTrue(findings.get(0).hasSignal(ConfidenceSignal.DOCUMENTED_RULE));
        assertTrue(findings.get(0).hasSignal(ConfidenceSignal.LOCATED));
        assertEquals("wrangler.toml", findings.get(1).getLocationFile());
        assertNull(findings.get(1).getLineRange());
    }

    @Test
    public void readsTopLevelArrayFromFile() throws Exception {
        Path report = folder.newFile("runtime.json").toPath();
        Files.write(report, "[{\"file\":\"src/a.ts\",\"line\":1,\"severity\":\"info\",\"message\":\"uses eval\"}]"
                .getBytes(StandardCharsets.UTF_8));

        List<RawFinding> payloads = ValidatorReportAnalyzer
                .forReportFile("runtime", FindingCategory.PLATFORM_PATTERN, report)
                .analyze(TARGET);

        assertEquals(1, payloads.size());
        assertEquals("P3", payloads.get(0).getSeverity());
        assertEquals("platform-pattern", payloads.get(0).getCategory());
    }

    @Test
    public void reportWithoutViolationsIsEmpty() throws Exception {
        ValidatorReportAnalyzer analyzer = new ValidatorReportAnalyzer("x", FindingCategory.OTHER,
                target -> "{\"summary\": \"clean\"}", new ObjectMapper());

        assertTrue(analyzer.analyze(TARGET).isEmpty());
    }

    @Test
    public void malformedReportFails() {
        ValidatorReportAnalyzer analyzer = new ValidatorReportAnalyzer("x", FindingCategory.OTHER,
                target -> "{not json", new ObjectMapper());

        assertThrows(IOException.class, () -> analyzer.analyze(TARGET));
    }

    @Test
    public void severityMapping() {
        assertEquals("P1", ValidatorReportAnalyzer.mapSeverity("ERROR"));
        assertEquals("P2", ValidatorReportAnalyzer.mapSeverity("warning"));
        assertEquals("P3", ValidatorReportAnalyzer.mapSeverity(" info "));
        assertEquals("P2", ValidatorReportAnalyzer.mapSeverity("P2"));
        assertNull(ValidatorReportAnalyzer.mapSeverity(null));
    }
}
