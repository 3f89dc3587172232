package com.teknolojikpanda.findings.synth.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SynthesisConfigTest {

    @Test
    public void defaultsAreValid() {
        SynthesisConfig config = SynthesisConfig.defaults();

        assertEquals(SynthesisConfig.DEFAULT_CONFIDENCE_THRESHOLD, config.getConfidenceThreshold());
        assertEquals(0, config.getAnalyzerParallelism());
    }

    @Test
    public void collectsAllViolations() {
        try {
            SynthesisConfig.builder()
                    .confidenceThreshold(101)
                    .trackerRetryDelayMs(500)
                    .trackerMaxRetryDelayMs(100)
                    .trackerBreakerThreshold(0)
                    .build();
            fail("Expected ConfigurationValidationException");
        } catch (ConfigurationValidationException e) {
            assertEquals(3, e.getErrors().size());
            assertTrue(e.getErrors().containsKey("confidenceThreshold"));
            assertTrue(e.getErrors().containsKey("trackerMaxRetryDelayMs"));
            assertTrue(e.getErrors().containsKey("trackerBreakerThreshold"));
        }
    }
}
