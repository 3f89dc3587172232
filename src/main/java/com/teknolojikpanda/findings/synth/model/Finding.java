package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A single normalized observation produced by an analyzer.
 * <p>
 * Instances are immutable. The scorer and the deduplicator derive updated copies through
 * {@link #toBuilder()}; nothing else changes {@code confidence}, {@code corroborations},
 * {@code mergedFrom} or {@code conflict}.
 */
public final class Finding {

    private final String id;
    private final String sourceAnalyzer;
    private final FindingCategory category;
    private final Severity severity;
    private final String locationFile;
    private final LineRange lineRange;
    private final String title;
    private final String description;
    private final List<String> evidenceSnippets;
    private final Set<ConfidenceSignal> rawConfidenceSignals;
    private final Integer confidence;
    private final int corroborations;
    private final SortedSet<String> mergedFrom;
    private final boolean conflict;

    private Finding(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.sourceAnalyzer = Objects.requireNonNull(builder.sourceAnalyzer, "sourceAnalyzer");
        this.category = Objects.requireNonNull(builder.category, "category");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.title = Objects.requireNonNull(builder.title, "title");
        if (builder.lineRange != null && builder.locationFile == null) {
            throw new IllegalArgumentException("lineRange requires locationFile");
        }
        if (builder.confidence != null && (builder.confidence < 0 || builder.confidence > 100)) {
            throw new IllegalArgumentException("confidence must be within [0, 100]: " + builder.confidence);
        }
        if (builder.corroborations < 0) {
            throw new IllegalArgumentException("corroborations must be >= 0");
        }
        this.locationFile = builder.locationFile;
        this.lineRange = builder.lineRange;
        this.description = builder.description != null ? builder.description : "";
        this.evidenceSnippets = Collections.unmodifiableList(new ArrayList<>(builder.evidenceSnippets));
        this.rawConfidenceSignals = Collections.unmodifiableSet(builder.rawConfidenceSignals.isEmpty()
                ? EnumSet.noneOf(ConfidenceSignal.class)
                : EnumSet.copyOf(builder.rawConfidenceSignals));
        this.confidence = builder.confidence;
        this.corroborations = builder.corroborations;
        this.mergedFrom = Collections.unmodifiableSortedSet(new TreeSet<>(builder.mergedFrom));
        this.conflict = builder.conflict;
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getSourceAnalyzer() {
        return sourceAnalyzer;
    }

    @Nonnull
    public FindingCategory getCategory() {
        return category;
    }

    @Nonnull
    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return the file, or {@code null} for repo-wide findings
     */
    @Nullable
    public String getLocationFile() {
        return locationFile;
    }

    @Nullable
    public LineRange getLineRange() {
        return lineRange;
    }

    @Nonnull
    public String getTitle() {
        return title;
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    @Nonnull
    public List<String> getEvidenceSnippets() {
        return evidenceSnippets;
    }

    @Nonnull
    public Set<ConfidenceSignal> getRawConfidenceSignals() {
        return rawConfidenceSignals;
    }

    public boolean hasSignal(@Nonnull ConfidenceSignal signal) {
        return rawConfidenceSignals.contains(signal);
    }

    public boolean isScored() {
        return confidence != null;
    }

    /**
     * @throws IllegalStateException when the finding has not been scored yet
     */
    public int getConfidence() {
        if (confidence == null) {
            throw new IllegalStateException("Finding " + id + " has not been scored");
        }
        return confidence;
    }

    /**
     * Number of additional findings this one absorbed as corroboration.
     */
    public int getCorroborations() {
        return corroborations;
    }

    @Nonnull
    public SortedSet<String> getMergedFrom() {
        return mergedFrom;
    }

    public boolean isConflict() {
        return conflict;
    }

    public boolean isRepoWide() {
        return locationFile == null;
    }

    @Nonnull
    public String locationDisplay() {
        if (locationFile == null) {
            return "(repository)";
        }
        return lineRange == null ? locationFile : locationFile + ":" + lineRange.asDisplay();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .sourceAnalyzer(sourceAnalyzer)
                .category(category)
                .severity(severity)
                .location(locationFile, lineRange)
                .title(title)
                .description(description)
                .evidenceSnippets(evidenceSnippets)
                .rawConfidenceSignals(rawConfidenceSignals)
                .confidence(confidence)
                .corroborations(corroborations)
                .mergedFrom(mergedFrom)
                .conflict(conflict);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding)) return false;
        Finding that = (Finding) o;
        return corroborations == that.corroborations
                && conflict == that.conflict
                && id.equals(that.id)
                && sourceAnalyzer.equals(that.sourceAnalyzer)
                && category == that.category
                && severity == that.severity
                && Objects.equals(locationFile, that.locationFile)
                && Objects.equals(lineRange, that.lineRange)
                && title.equals(that.title)
                && description.equals(that.description)
                && evidenceSnippets.equals(that.evidenceSnippets)
                && rawConfidenceSignals.equals(that.rawConfidenceSignals)
                && Objects.equals(confidence, that.confidence)
                && mergedFrom.equals(that.mergedFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceAnalyzer, category, severity, locationFile, lineRange, title,
                confidence, corroborations, mergedFrom, conflict);
    }

    @Override
    public String toString() {
        return "Finding{" + id
                + ", " + severity
                + ", " + category.label()
                + ", " + locationDisplay()
                + ", confidence=" + confidence
                + (conflict ? ", conflict" : "")
                + ", title='" + title + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String sourceAnalyzer;
        private FindingCategory category = FindingCategory.OTHER;
        private Severity severity;
        private String locationFile;
        private LineRange lineRange;
        private String title;
        private String description;
        private List<String> evidenceSnippets = new ArrayList<>();
        private Set<ConfidenceSignal> rawConfidenceSignals = EnumSet.noneOf(ConfidenceSignal.class);
        private Integer confidence;
        private int corroborations;
        private Set<String> mergedFrom = new TreeSet<>();
        private boolean conflict;

        public Builder id(@Nonnull String value) {
            this.id = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder sourceAnalyzer(@Nonnull String value) {
            this.sourceAnalyzer = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder category(@Nonnull FindingCategory value) {
            this.category = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder severity(@Nonnull Severity value) {
            this.severity = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder location(@Nullable String file, @Nullable LineRange range) {
            this.locationFile = file;
            this.lineRange = range;
            return this;
        }

        public Builder title(@Nonnull String value) {
            this.title = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder description(@Nullable String value) {
            this.description = value;
            return this;
        }

        public Builder evidenceSnippets(@Nonnull List<String> values) {
            this.evidenceSnippets = new ArrayList<>(Objects.requireNonNull(values, "values"));
            return this;
        }

        public Builder rawConfidenceSignals(@Nonnull Set<ConfidenceSignal> values) {
            Objects.requireNonNull(values, "values");
            this.rawConfidenceSignals = values.isEmpty()
                    ? EnumSet.noneOf(ConfidenceSignal.class)
                    : EnumSet.copyOf(values);
            return this;
        }

        public Builder confidence(@Nullable Integer value) {
            this.confidence = value;
            return this;
        }

        public Builder corroborations(int value) {
            this.corroborations = value;
            return this;
        }

        public Builder mergedFrom(@Nonnull Set<String> values) {
            this.mergedFrom = new TreeSet<>(Objects.requireNonNull(values, "values"));
            return this;
        }

        public Builder conflict(boolean value) {
            this.conflict = value;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}
