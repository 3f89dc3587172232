package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One finding as shown to the reviewer, with its position in the queue.
 */
public final class FindingPresentation {

    private final Finding finding;
    private final int position;
    private final int total;

    public FindingPresentation(@Nonnull Finding finding, int position, int total) {
        this.finding = Objects.requireNonNull(finding, "finding");
        if (position < 1 || position > total) {
            throw new IllegalArgumentException("position " + position + " outside 1.." + total);
        }
        this.position = position;
        this.total = total;
    }

    @Nonnull
    public Finding getFinding() {
        return finding;
    }

    /**
     * 1-based queue position.
     */
    public int getPosition() {
        return position;
    }

    public int getTotal() {
        return total;
    }

    /**
     * Renders every field of the finding, plain text, one field per line.
     */
    @Nonnull
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(position).append('/').append(total).append("] ")
                .append(finding.getId()).append(" - ").append(finding.getTitle()).append('\n');
        sb.append("  Severity:   ").append(finding.getSeverity()).append('\n');
        sb.append("  Category:   ").append(finding.getCategory().label()).append('\n');
        sb.append("  Confidence: ").append(finding.isScored() ? String.valueOf(finding.getConfidence()) : "unscored");
        if (finding.getCorroborations() > 0) {
            sb.append(" (corroborated ").append(finding.getCorroborations()).append("x)");
        }
        sb.append('\n');
        sb.append("  Location:   ").append(finding.locationDisplay()).append('\n');
        sb.append("  Source:     ").append(finding.getSourceAnalyzer()).append('\n');
        if (!finding.getMergedFrom().isEmpty()) {
            sb.append("  Merged:     ").append(String.join(", ", finding.getMergedFrom())).append('\n');
        }
        if (finding.isConflict()) {
            sb.append("  CONFLICT:   analyzers disagree on severity for this location\n");
        }
        if (!finding.getRawConfidenceSignals().isEmpty()) {
            sb.append("  Signals:    ").append(finding.getRawConfidenceSignals().stream()
                    .map(ConfidenceSignal::getKey)
                    .collect(Collectors.joining(", "))).append('\n');
        }
        if (!finding.getDescription().isEmpty()) {
            sb.append("  Description:\n");
            for (String line : finding.getDescription().split("\n")) {
                sb.append("    ").append(line).append('\n');
            }
        }
        if (!finding.getEvidenceSnippets().isEmpty()) {
            sb.append("  Evidence:\n");
            for (String snippet : finding.getEvidenceSnippets()) {
                for (String line : snippet.split("\n")) {
                    sb.append("    > ").append(line).append('\n');
                }
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "FindingPresentation{" + finding.getId() + ", " + position + "/" + total + "}";
    }
}
