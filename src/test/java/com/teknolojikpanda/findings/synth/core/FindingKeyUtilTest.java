package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.LineRange;
import com.teknolojikpanda.findings.synth.model.Severity;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class FindingKeyUtilTest {

    @Test
    public void titleNormalizationIgnoresCaseAndWhitespace() {
        assertEquals("missing kv binding", FindingKeyUtil.normalizeTitle("  Missing\tKV \n binding "));
        assertEquals("", FindingKeyUtil.normalizeTitle(null));
    }

    @Test
    public void pathNormalizationUsesForwardSlashes() {
        assertEquals("src/app.ts", FindingKeyUtil.normalizePath(".\\src\\app.ts"));
        assertEquals("src/app.ts", FindingKeyUtil.normalizePath("./src/app.ts"));
    }

    @Test
    public void locatedFindingsShareBucketRegardlessOfTitle() {
        Finding first = finding("F-00001", "Unbounded loop", LineRange.singleLine(3));
        Finding second = finding("F-00002", "Something else", LineRange.of(10, 12));

        assertEquals(FindingKeyUtil.bucketKey(first), FindingKeyUtil.bucketKey(second));
    }

    @Test
    public void fingerprintIgnoresSessionIdButNotContent() {
        Finding first = finding("F-00001", "Unbounded loop", LineRange.singleLine(3));
        Finding renumbered = first.toBuilder().id("F-00042").build();
        Finding moved = first.toBuilder().location("src/app.ts", LineRange.singleLine(4)).build();

        assertEquals(FindingKeyUtil.fingerprint(first), FindingKeyUtil.fingerprint(renumbered));
        assertNotEquals(FindingKeyUtil.fingerprint(first), FindingKeyUtil.fingerprint(moved));
    }

    private static Finding finding(String id, String title, LineRange range) {
        return Finding.builder()
                .id(id)
                .sourceAnalyzer("perf")
                .category(FindingCategory.PERFORMANCE)
                .severity(Severity.P2)
                .location("src/app.ts", range)
                .title(title)
                .build();
    }
}
