package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.api.Analyzer;
import com.teknolojikpanda.findings.synth.model.AnalyzerResult;
import com.teknolojikpanda.findings.synth.model.AnalyzerResults;
import com.teknolojikpanda.findings.synth.model.AnalyzerStatus;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import com.teknolojikpanda.findings.synth.model.Severity;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import com.teknolojikpanda.findings.synth.model.SynthesisResult;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class FindingSynthesisPipelineTest {

    private FindingSynthesisPipeline pipeline;
    private InMemoryMetricsRecorder metrics;

    @Before
    public void setUp() {
        pipeline = FindingSynthesisPipeline.createDefault();
        metrics = new InMemoryMetricsRecorder();
    }

    @Test
    public void corroboratedFindingWithFullEvidenceSurvives() {
        RawFinding strong = RawFinding.builder()
                .title("Secret committed to wrangler.toml")
                .category("security")
                .severity("P1")
                .location("wrangler.toml", 12)
                .addEvidence("API_KEY = \"sk-live-...\"")
                .signal("changedContent", true)
                .signal("documentedRule", true)
                .build();
        RawFinding echo = RawFinding.builder()
                .title("Hard-coded credential")
                .category("security")
                .severity("P1")
                .location("wrangler.toml", 12)
                .build();

        SynthesisResult result = pipeline.synthesize(results(
                AnalyzerResult.completed("security", Collections.singletonList(strong), Duration.ZERO),
                AnalyzerResult.completed("patterns", Collections.singletonList(echo), Duration.ZERO)), 80, metrics);

        assertEquals(1, result.getQueue().size());
        Finding survivor = result.getQueue().get(0);
        assertEquals("F-00001", survivor.getId());
        assertEquals(90, survivor.getConfidence());
        assertEquals(1, survivor.getCorroborations());
        assertEquals(Collections.singleton("F-00002"), survivor.getMergedFrom());
        assertEquals(1L, metrics.counter("findings.merged"));
    }

    @Test
    public void weakFindingWithFalsePositiveIndicatorsIsFiltered() {
        RawFinding weak = RawFinding.builder()
                .title("Prefer const over let")
                .category("style")
                .severity("P3")
                .location("src/index.ts", 3)
                .signal("unchangedContent", true)
                .signal("stylePreference", true)
                .build();

        SynthesisResult result = pipeline.synthesize(results(
                AnalyzerResult.completed("quality", Collections.singletonList(weak), Duration.ZERO)), 80, metrics);

        assertEquals(0, result.getDeduplicated().get(0).getConfidence());
        assertTrue(result.getQueue().isEmpty());
        assertEquals(1, result.getDistribution().getLow());
        assertEquals(1L, metrics.counter("findings.filtered"));
    }

    @Test
    public void conflictingSeveritiesBothReachTheQueue() {
        RawFinding critical = RawFinding.builder()
                .title("Unbounded fetch fan-out")
                .category("performance")
                .severity("P1")
                .location("src/worker.ts", 40)
                .addEvidence("await Promise.all(urls.map(fetch))")
                .signal("changedContent", true)
                .signal("documentedRule", true)
                .build();
        RawFinding minorOne = RawFinding.builder()
                .title("Many parallel requests")
                .category("performance")
                .severity("P3")
                .location("src/worker.ts", 40)
                .build();
        RawFinding minorTwo = RawFinding.builder()
                .title("Consider batching requests")
                .category("perf")
                .severity("P3")
                .location("src/worker.ts", 40)
                .build();

        SynthesisResult result = pipeline.synthesize(results(
                AnalyzerResult.completed("a", Collections.singletonList(critical), Duration.ZERO),
                AnalyzerResult.completed("b", Collections.singletonList(minorOne), Duration.ZERO),
                AnalyzerResult.completed("c", Collections.singletonList(minorTwo), Duration.ZERO)), 80, metrics);

        List<Finding> queue = result.getQueue();
        assertEquals(2, queue.size());
        assertEquals(Severity.P1, queue.get(0).getSeverity());
        assertEquals(80, queue.get(0).getConfidence());
        assertEquals(Severity.P3, queue.get(1).getSeverity());
        assertEquals(30, queue.get(1).getConfidence());
        assertTrue(queue.get(0).isConflict());
        assertTrue(queue.get(1).isConflict());
        assertEquals(2, result.getConflictCount());
    }

    @Test
    public void timedOutAnalyzerDoesNotBlockTheOthers() {
        List<Analyzer> analyzers = Arrays.asList(
                StaticAnalyzer.returning("A", StaticAnalyzer.distinct("a", 5)),
                StaticAnalyzer.sleeping("B", 10_000L, StaticAnalyzer.distinct("b", 1).get(0)),
                StaticAnalyzer.returning("C", StaticAnalyzer.distinct("c", 3)));
        SynthesisConfig config = SynthesisConfig.builder().analyzerTimeoutMs(300L).build();

        SynthesisResult result = pipeline.run(ReviewTarget.of("main..feature"), analyzers, config, metrics, null);

        assertEquals(8, result.getIngestedCount());
        assertEquals(AnalyzerStatus.TIMED_OUT, result.getAnalyzerResults().get("B").getStatus());
        assertEquals(8L, metrics.counter("findings.ingested"));
    }

    @Test
    public void rejectedPayloadsAreReportedNotFatal() {
        RawFinding invalid = RawFinding.builder().category("security").severity("P1").build();
        RawFinding valid = StaticAnalyzer.located("Leaky cache key", "security", "P2", "src/cache.ts", 9);

        SynthesisResult result = pipeline.synthesize(results(
                AnalyzerResult.completed("security", Arrays.asList(invalid, valid), Duration.ZERO)), 0, metrics);

        assertEquals(1, result.getIngestedCount());
        assertEquals(1, result.getIngestion().getErrors().size());
        assertEquals("F-00001", result.getQueue().get(0).getId());
    }

    @Test
    public void thresholdOutsideRangeIsRejected() {
        AnalyzerResults empty = results();

        assertThrows(IllegalArgumentException.class, () -> pipeline.synthesize(empty, 101, metrics));
        assertThrows(IllegalArgumentException.class, () -> pipeline.synthesize(empty, -1, metrics));
    }

    private static AnalyzerResults results(AnalyzerResult... results) {
        return new AnalyzerResults(Arrays.asList(results));
    }
}
