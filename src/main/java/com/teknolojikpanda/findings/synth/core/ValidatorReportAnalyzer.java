package com.teknolojikpanda.findings.synth.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teknolojikpanda.findings.synth.api.Analyzer;
import com.teknolojikpanda.findings.synth.model.ConfidenceSignal;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.RawFinding;
import com.teknolojikpanda.findings.synth.model.ReviewTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Adapts the JSON report of a deterministic validator (secret scanner, runtime checker, ...)
 * to the analyzer contract.
 * <p>
 * The report is an object with a {@code violations} (or {@code issues}) array, or the array
 * itself. Each entry has {@code file}, {@code line}, {@code severity}
 * ({@code critical}/{@code warning}/{@code info}), {@code message}, and optionally
 * {@code code}, {@code type}, {@code fix} and {@code context}. A line of 0 or less marks a
 * file-level violation.
 */
public class ValidatorReportAnalyzer implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(ValidatorReportAnalyzer.class);

    /**
     * Supplies the raw report for a target.
     */
    @FunctionalInterface
    public interface ReportSource {
        @Nonnull
        String read(@Nonnull ReviewTarget target) throws IOException;
    }

    private final String id;
    private final FindingCategory category;
    private final ReportSource source;
    private final ObjectMapper objectMapper;

    public ValidatorReportAnalyzer(@Nonnull String id,
                                   @Nonnull FindingCategory category,
                                   @Nonnull ReportSource source,
                                   @Nonnull ObjectMapper objectMapper) {
        this.id = Objects.requireNonNull(id, "id");
        this.category = Objects.requireNonNull(category, "category");
        this.source = Objects.requireNonNull(source, "source");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ValidatorReportAnalyzer forReportFile(@Nonnull String id,
                                                        @Nonnull FindingCategory category,
                                                        @Nonnull Path report) {
        Objects.requireNonNull(report, "report");
        return new ValidatorReportAnalyzer(id, category,
                target -> new String(Files.readAllBytes(report), StandardCharsets.UTF_8),
                new ObjectMapper());
    }

    @Nonnull
    @Override
    public String getId() {
        return id;
    }

    /**
     * @throws IOException when the report cannot be read or is not valid JSON
     */
    @Nonnull
    @Override
    public List<RawFinding> analyze(@Nonnull ReviewTarget target) throws IOException {
        JsonNode root = objectMapper.readTree(source.read(target));
        JsonNode entries = violations(root);
        if (entries == null) {
            log.debug("Validator report for {} has no violations array", id);
            return Collections.emptyList();
        }
        List<RawFinding> payloads = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (entry.isObject()) {
                payloads.add(toPayload(entry));
            }
        }
        return payloads;
    }

    @Nullable
    private static JsonNode violations(@Nullable JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        for (String field : new String[]{"violations", "issues"}) {
            JsonNode node = root.get(field);
            if (node != null && node.isArray()) {
                return node;
            }
        }
        return null;
    }

    private RawFinding toPayload(JsonNode entry) {
        String type = text(entry, "type");
        String message = text(entry, "message");
        RawFinding.Builder builder = RawFinding.builder()
                .title(message != null ? message : type)
                .category(category.label())
                .severity(mapSeverity(text(entry, "severity")))
                .locationFile(text(entry, "file"))
                .description(describe(type, text(entry, "fix"), text(entry, "context")));

        JsonNode line = entry.get("line");
        if (line != null && line.canConvertToInt() && line.asInt() > 0) {
            builder.locationLine(line.asInt());
        }
        String code = text(entry, "code");
        if (code != null) {
            builder.addEvidence(code);
        }
        if (type != null) {
            builder.signal(ConfidenceSignal.DOCUMENTED_RULE.getKey(), true);
        }
        return builder.build();
    }

    /**
     * {@code critical} → P1, {@code warning} → P2, {@code info} → P3. Anything else is passed
     * through so the ingestor rejects it.
     */
    @Nullable
    static String mapSeverity(@Nullable String severity) {
        if (severity == null) {
            return null;
        }
        switch (severity.trim().toLowerCase(Locale.ENGLISH)) {
            case "critical":
            case "error":
                return "P1";
            case "warning":
                return "P2";
            case "info":
                return "P3";
            default:
                return severity;
        }
    }

    private static String describe(@Nullable String type, @Nullable String fix, @Nullable String context) {
        StringBuilder sb = new StringBuilder();
        if (type != null) {
            sb.append("Rule: ").append(type);
        }
        if (context != null) {
            appendLine(sb, context);
        }
        if (fix != null) {
            appendLine(sb, "Fix: " + fix);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String text) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(text);
    }

    @Nullable
    private static String text(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
