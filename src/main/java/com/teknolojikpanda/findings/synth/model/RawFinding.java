package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unvalidated payload exactly as an analyzer returned it. Every field may be missing; the
 * ingestor decides what is acceptable.
 */
public final class RawFinding {

    private final String title;
    private final String category;
    private final String severity;
    private final String locationFile;
    private final Integer locationLine;
    private final Integer locationEndLine;
    private final String description;
    private final List<String> evidenceSnippets;
    private final Map<String, Object> rawConfidenceSignals;

    private RawFinding(Builder builder) {
        this.title = builder.title;
        this.category = builder.category;
        this.severity = builder.severity;
        this.locationFile = builder.locationFile;
        this.locationLine = builder.locationLine;
        this.locationEndLine = builder.locationEndLine;
        this.description = builder.description;
        this.evidenceSnippets = Collections.unmodifiableList(new ArrayList<>(builder.evidenceSnippets));
        this.rawConfidenceSignals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rawConfidenceSignals));
    }

    @Nullable
    public String getTitle() {
        return title;
    }

    @Nullable
    public String getCategory() {
        return category;
    }

    @Nullable
    public String getSeverity() {
        return severity;
    }

    @Nullable
    public String getLocationFile() {
        return locationFile;
    }

    @Nullable
    public Integer getLocationLine() {
        return locationLine;
    }

    @Nullable
    public Integer getLocationEndLine() {
        return locationEndLine;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    @Nonnull
    public List<String> getEvidenceSnippets() {
        return evidenceSnippets;
    }

    @Nonnull
    public Map<String, Object> getRawConfidenceSignals() {
        return rawConfidenceSignals;
    }

    /**
     * Reads a payload decoded from JSON. Recognized keys: {@code title}, {@code category},
     * {@code severity}, {@code location} ({@code file}, {@code line}, {@code endLine}) or flat
     * {@code file}/{@code line}, {@code description}, {@code evidenceSnippets} and
     * {@code rawConfidenceSignals}. Values of the wrong shape are dropped rather than rejected
     * here so the ingestor can report them per field.
     */
    @Nonnull
    public static RawFinding fromMap(@Nonnull Map<?, ?> map) {
        Objects.requireNonNull(map, "map");
        Builder builder = builder()
                .title(optionalString(map.get("title")))
                .category(optionalString(map.get("category")))
                .severity(optionalString(map.get("severity")))
                .description(optionalString(map.get("description")));

        Object location = map.get("location");
        Map<?, ?> locationMap = location instanceof Map ? (Map<?, ?>) location : map;
        builder.locationFile(optionalString(locationMap.get("file")));
        builder.locationLine(parseLine(locationMap.get("line")));
        builder.locationEndLine(parseLine(locationMap.get("endLine")));

        Object snippets = map.get("evidenceSnippets");
        if (snippets instanceof List) {
            List<String> values = new ArrayList<>();
            for (Object snippet : (List<?>) snippets) {
                if (snippet != null) {
                    values.add(snippet.toString());
                }
            }
            builder.evidenceSnippets(values);
        }

        Object signals = map.get("rawConfidenceSignals");
        if (signals instanceof Map) {
            Map<String, Object> values = new LinkedHashMap<>();
            ((Map<?, ?>) signals).forEach((key, value) -> {
                if (key != null) {
                    values.put(key.toString(), value);
                }
            });
            builder.rawConfidenceSignals(values);
        }
        return builder.build();
    }

    @Nullable
    private static String optionalString(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        String str = value.toString();
        return str.isEmpty() ? null : str;
    }

    /**
     * Reads a line number from JSON input. Fractional, out-of-range and non-numeric values map to
     * 0, which the ingestor rejects.
     */
    @Nullable
    private static Integer parseLine(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            return 0;
        }
    }


    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String category;
        private String severity;
        private String locationFile;
        private Integer locationLine;
        private Integer locationEndLine;
        private String description;
        private List<String> evidenceSnippets = new ArrayList<>();
        private Map<String, Object> rawConfidenceSignals = new LinkedHashMap<>();

        public Builder title(@Nullable String value) {
            this.title = value;
            return this;
        }

        public Builder category(@Nullable String value) {
            this.category = value;
            return this;
        }

        public Builder severity(@Nullable String value) {
            this.severity = value;
            return this;
        }

        public Builder location(@Nullable String file, @Nullable Integer line) {
            this.locationFile = file;
            this.locationLine = line;
            return this;
        }

        public Builder locationFile(@Nullable String value) {
            this.locationFile = value;
            return this;
        }

        public Builder locationLine(@Nullable Integer value) {
            this.locationLine = value;
            return this;
        }

        public Builder locationEndLine(@Nullable Integer value) {
            this.locationEndLine = value;
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

        public Builder addEvidence(@Nonnull String snippet) {
            this.evidenceSnippets.add(Objects.requireNonNull(snippet, "snippet"));
            return this;
        }

        public Builder rawConfidenceSignals(@Nonnull Map<String, Object> values) {
            this.rawConfidenceSignals = new LinkedHashMap<>(Objects.requireNonNull(values, "values"));
            return this;
        }

        public Builder signal(@Nonnull String key, @Nullable Object value) {
            this.rawConfidenceSignals.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public RawFinding build() {
            return new RawFinding(this);
        }
    }
}
