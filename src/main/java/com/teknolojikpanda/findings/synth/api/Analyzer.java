package com.teknolojikpanda.findings.synth.api;

import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Independent producer of candidate findings for a review target (security, performance,
 * deterministic pre-checks, ...). Implementations must not share mutable state with other
 * analyzers; they are invoked concurrently and may be interrupted on timeout.
 */
public interface Analyzer {

    /**
     * Stable identifier, unique within a run.
     */
    @Nonnull
    String getId();

    /**
     * @return payloads in the analyzer's own order
     * @throws Exception any failure; the analyzer then contributes nothing
     */
    @Nonnull
    List<RawFinding> analyze(@Nonnull ReviewTarget target) throws Exception;
}
