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
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Validates analyzer payloads and turns them into unscored {@link Finding}s.
 * <p>
 * One instance represents one session: ids ({@code F-00001}, {@code F-00002}, ...) are drawn
 * from its own sequence, so ingesting analyzer results in registration order yields the same
 * ids on every run with the same input. A rejected payload consumes no id.
 */
public class FindingIngestor {

    private static final Logger log = LoggerFactory.getLogger(FindingIngestor.class);
    private static final String ID_FORMAT = "F-%05d";

    private final AtomicLong sequence = new AtomicLong();

    /**
     * Ingests every completed analyzer's payloads in registration order. Timed-out and failed
     * analyzers carry no payloads and contribute nothing.
     */
    @Nonnull
    public IngestionResult ingest(@Nonnull AnalyzerResults results) {
        Objects.requireNonNull(results, "results");
        IngestionResult combined = IngestionResult.empty();
        for (AnalyzerResult result : results.all()) {
            combined = combined.plus(ingest(result.getAnalyzerId(), result.getPayloads()));
        }
        return combined;
    }

    @Nonnull
    public IngestionResult ingest(@Nonnull String analyzerId, @Nonnull List<RawFinding> payloads) {
        Objects.requireNonNull(analyzerId, "analyzerId");
        Objects.requireNonNull(payloads, "payloads");
        List<Finding> findings = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < payloads.size(); i++) {
            RawFinding payload = payloads.get(i);
            List<ValidationError> payloadErrors = validate(analyzerId, i, payload);
            if (!payloadErrors.isEmpty()) {
                errors.addAll(payloadErrors);
                LogSupport.warn(log, LogEvent.INGEST_REJECTED, "Analyzer payload rejected",
                        "analyzer", analyzerId,
                        "index", i,
                        "errors", payloadErrors.size(),
                        "firstError", payloadErrors.get(0).getField() + ": " + payloadErrors.get(0).getMessage());
                continue;
            }
            findings.add(normalize(analyzerId, payload));
        }
        LogSupport.debug(log, LogEvent.INGEST_BATCH, null,
                "analyzer", analyzerId,
                "accepted", findings.size(),
                "rejected", payloads.size() - findings.size());
        return new IngestionResult(findings, errors);
    }

    private List<ValidationError> validate(String analyzerId, int index, @Nullable RawFinding payload) {
        List<ValidationError> errors = new ArrayList<>();
        if (payload == null) {
            errors.add(new ValidationError(analyzerId, index, "payload", "payload is null"));
            return errors;
        }
        if (isBlank(payload.getTitle())) {
            errors.add(new ValidationError(analyzerId, index, "title", "title is required"));
        }
        if (isBlank(payload.getCategory())) {
            errors.add(new ValidationError(analyzerId, index, "category", "category is required"));
        }
        if (isBlank(payload.getSeverity())) {
            errors.add(new ValidationError(analyzerId, index, "severity", "severity is required"));
        } else if (Severity.parse(payload.getSeverity()) == null) {
            errors.add(new ValidationError(analyzerId, index, "severity",
                    "severity must be one of P1, P2, P3 but was '" + payload.getSeverity() + "'"));
        }
        Integer line = payload.getLocationLine();
        Integer endLine = payload.getLocationEndLine();
        if (line != null) {
            if (isBlank(payload.getLocationFile())) {
                errors.add(new ValidationError(analyzerId, index, "location.file", "a line requires a file"));
            }
            if (line < 1) {
                errors.add(new ValidationError(analyzerId, index, "location.line", "line must be >= 1 but was " + line));
            } else if (endLine != null && endLine < line) {
                errors.add(new ValidationError(analyzerId, index, "location.endLine",
                        "endLine " + endLine + " is before line " + line));
            }
        } else if (endLine != null) {
            errors.add(new ValidationError(analyzerId, index, "location.endLine", "endLine requires line"));
        }
        return errors;
    }

    private Finding normalize(String analyzerId, RawFinding payload) {
        String file = isBlank(payload.getLocationFile()) ? null : FindingKeyUtil.normalizePath(payload.getLocationFile());
        LineRange range = null;
        if (payload.getLocationLine() != null) {
            int start = payload.getLocationLine();
            int end = payload.getLocationEndLine() != null ? payload.getLocationEndLine() : start;
            range = LineRange.of(start, end);
        }
        List<String> evidence = new ArrayList<>();
        for (String snippet : payload.getEvidenceSnippets()) {
            if (!isBlank(snippet)) {
                evidence.add(snippet);
            }
        }
        return Finding.builder()
                .id(String.format(Locale.ROOT, ID_FORMAT, sequence.incrementAndGet()))
                .sourceAnalyzer(analyzerId)
                .category(FindingCategory.fromString(payload.getCategory()))
                .severity(Severity.parse(payload.getSeverity()))
                .location(file, range)
                .title(payload.getTitle().trim())
                .description(payload.getDescription())
                .evidenceSnippets(evidence)
                .rawConfidenceSignals(signals(analyzerId, file, range, evidence, payload.getRawConfidenceSignals()))
                .build();
    }

    private Set<ConfidenceSignal> signals(String analyzerId,
                                          @Nullable String file,
                                          @Nullable LineRange range,
                                          List<String> evidence,
                                          Map<String, Object> declared) {
        Set<ConfidenceSignal> signals = EnumSet.noneOf(ConfidenceSignal.class);
        if (file != null && range != null) {
            signals.add(ConfidenceSignal.LOCATED);
        }
        if (!evidence.isEmpty()) {
            signals.add(ConfidenceSignal.QUOTED_EXCERPT);
        }
        for (Map.Entry<String, Object> entry : declared.entrySet()) {
            ConfidenceSignal signal = ConfidenceSignal.fromKey(entry.getKey());
            if (signal == null) {
                log.debug("Ignoring unknown confidence signal '{}' from analyzer {}", entry.getKey(), analyzerId);
                continue;
            }
            if (signal.isDerived()) {
                continue;
            }
            if (isPresent(entry.getValue())) {
                signals.add(signal);
            }
        }
        return signals;
    }

    /**
     * A declared signal counts when it is {@code true}, a positive number, or the text
     * {@code true}/{@code yes}.
     */
    static boolean isPresent(@Nullable Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() > 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toLowerCase(Locale.ENGLISH);
            return "true".equals(text) || "yes".equals(text);
        }
        return false;
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.trim().isEmpty();
    }
}
