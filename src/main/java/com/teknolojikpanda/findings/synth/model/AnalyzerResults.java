package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable collection of analyzer results keyed by analyzer id, in analyzer registration order.
 */
public final class AnalyzerResults {

    private final Map<String, AnalyzerResult> byAnalyzer;

    public AnalyzerResults(@Nonnull Collection<AnalyzerResult> results) {
        Objects.requireNonNull(results, "results");
        Map<String, AnalyzerResult> map = new LinkedHashMap<>();
        for (AnalyzerResult result : results) {
            if (map.putIfAbsent(result.getAnalyzerId(), result) != null) {
                throw new IllegalArgumentException("Duplicate analyzer id: " + result.getAnalyzerId());
            }
        }
        this.byAnalyzer = Collections.unmodifiableMap(map);
    }

    @Nullable
    public AnalyzerResult get(@Nonnull String analyzerId) {
        return byAnalyzer.get(analyzerId);
    }

    @Nonnull
    public List<AnalyzerResult> all() {
        return new ArrayList<>(byAnalyzer.values());
    }

    @Nonnull
    public Map<String, AnalyzerResult> asMap() {
        return byAnalyzer;
    }

    @Nonnull
    public List<String> idsWithStatus(@Nonnull AnalyzerStatus status) {
        return byAnalyzer.values().stream()
                .filter(result -> result.getStatus() == status)
                .map(AnalyzerResult::getAnalyzerId)
                .collect(Collectors.toList());
    }

    public int totalPayloads() {
        return byAnalyzer.values().stream().mapToInt(result -> result.getPayloads().size()).sum();
    }

    public int size() {
        return byAnalyzer.size();
    }
}
