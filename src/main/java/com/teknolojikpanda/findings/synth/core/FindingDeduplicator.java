package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.Severity;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.inject.Inject;
import javax.inject.Named;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Groups findings that describe the same issue and collapses each group to one survivor.
 * <p>
 * Located findings group on file and category when their line ranges overlap, transitively.
 * File-level and repo-wide findings group on their normalized title instead. Inside a group
 * with a single severity the highest-confidence member survives (lowest id on ties), absorbs
 * the others into {@code mergedFrom} and gains one corroboration per absorbed member. A group
 * whose members disagree on severity is merged per severity only, and every survivor is
 * flagged as a conflict. Conflict flags are never cleared, which keeps a second pass a no-op.
 */
@Named
public class FindingDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(FindingDeduplicator.class);

    private static final Comparator<Finding> SURVIVOR_ORDER = Comparator
            .comparingInt(Finding::getConfidence).reversed()
            .thenComparing(Finding::getId);

    private final ConfidenceScorer scorer;

    @Inject
    public FindingDeduplicator(@Nonnull ConfidenceScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * @param findings scored findings
     * @return survivors in the order they appeared in the input
     * @throws IllegalStateException when a finding has not been scored
     */
    @Nonnull
    public List<Finding> merge(@Nonnull List<Finding> findings) {
        Objects.requireNonNull(findings, "findings");
        for (Finding finding : findings) {
            if (!finding.isScored()) {
                throw new IllegalStateException("Finding " + finding.getId() + " must be scored before merging");
            }
        }
        Map<String, Finding> survivors = new HashMap<>();
        for (List<Finding> group : group(findings)) {
            for (Finding survivor : collapse(group)) {
                survivors.put(survivor.getId(), survivor);
            }
        }
        List<Finding> result = new ArrayList<>(survivors.size());
        for (Finding finding : findings) {
            Finding survivor = survivors.remove(finding.getId());
            if (survivor != null) {
                result.add(survivor);
            }
        }
        return result;
    }

    /**
     * Partitions findings into duplicate groups. Group order and member order are deterministic.
     */
    @Nonnull
    List<List<Finding>> group(@Nonnull List<Finding> findings) {
        Map<String, List<Finding>> buckets = new LinkedHashMap<>();
        for (Finding finding : findings) {
            buckets.computeIfAbsent(FindingKeyUtil.bucketKey(finding), key -> new ArrayList<>()).add(finding);
        }
        List<List<Finding>> groups = new ArrayList<>();
        for (List<Finding> bucket : buckets.values()) {
            if (bucket.get(0).getLineRange() == null) {
                groups.add(bucket);
            } else {
                groups.addAll(splitByOverlap(bucket));
            }
        }
        return groups;
    }

    // Sweep over ranges sorted by start; a gap after the running max end closes a group.
    private List<List<Finding>> splitByOverlap(List<Finding> bucket) {
        List<Finding> sorted = new ArrayList<>(bucket);
        sorted.sort(Comparator.comparing(Finding::getLineRange).thenComparing(Finding::getId));
        List<List<Finding>> groups = new ArrayList<>();
        List<Finding> current = new ArrayList<>();
        int maxEnd = Integer.MIN_VALUE;
        for (Finding finding : sorted) {
            if (!current.isEmpty() && finding.getLineRange().getStart() > maxEnd) {
                groups.add(current);
                current = new ArrayList<>();
                maxEnd = Integer.MIN_VALUE;
            }
            current.add(finding);
            maxEnd = Math.max(maxEnd, finding.getLineRange().getEnd());
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private List<Finding> collapse(List<Finding> group) {
        Map<Severity, List<Finding>> bySeverity = new EnumMap<>(Severity.class);
        for (Finding finding : group) {
            bySeverity.computeIfAbsent(finding.getSeverity(), key -> new ArrayList<>()).add(finding);
        }
        boolean conflict = bySeverity.size() > 1;
        if (conflict) {
            LogSupport.info(log, LogEvent.DEDUP_CONFLICT, "Analyzers disagree on severity; keeping one finding per severity",
                    "location", group.get(0).locationDisplay(),
                    "category", group.get(0).getCategory().label(),
                    "severities", bySeverity.keySet(),
                    "members", group.size());
        }
        List<Finding> survivors = new ArrayList<>(bySeverity.size());
        for (List<Finding> members : bySeverity.values()) {
            survivors.add(absorb(members, conflict));
        }
        return survivors;
    }

    private Finding absorb(List<Finding> members, boolean conflict) {
        List<Finding> ranked = new ArrayList<>(members);
        ranked.sort(SURVIVOR_ORDER);
        Finding survivor = ranked.get(0);
        if (ranked.size() == 1 && (!conflict || survivor.isConflict())) {
            return survivor;
        }
        Set<String> mergedFrom = new TreeSet<>(survivor.getMergedFrom());
        int corroborations = survivor.getCorroborations();
        for (Finding absorbed : ranked.subList(1, ranked.size())) {
            mergedFrom.add(absorbed.getId());
            mergedFrom.addAll(absorbed.getMergedFrom());
            corroborations++;
        }
        Finding merged = survivor.toBuilder()
                .mergedFrom(mergedFrom)
                .corroborations(corroborations)
                .conflict(survivor.isConflict() || conflict)
                .build();
        if (ranked.size() > 1) {
            log.debug("Merged {} into {} (corroborations={})", mergedFrom, survivor.getId(), corroborations);
        }
        return merged.toBuilder().confidence(scorer.recompute(merged)).build();
    }
}
