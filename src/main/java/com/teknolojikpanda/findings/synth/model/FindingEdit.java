package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reviewer changes to a presented finding. Unset fields keep the current value. Identity,
 * location, signals and confidence are not editable.
 */
public final class FindingEdit {

    private final String title;
    private final String description;
    private final Severity severity;
    private final FindingCategory category;
    private final List<String> evidenceSnippets;

    private FindingEdit(Builder builder) {
        this.title = builder.title;
        this.description = builder.description;
        this.severity = builder.severity;
        this.category = builder.category;
        this.evidenceSnippets = builder.evidenceSnippets == null
                ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.evidenceSnippets));
    }

    @Nullable
    public String getTitle() {
        return title;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    @Nullable
    public Severity getSeverity() {
        return severity;
    }

    @Nullable
    public FindingCategory getCategory() {
        return category;
    }

    @Nullable
    public List<String> getEvidenceSnippets() {
        return evidenceSnippets;
    }

    public boolean isEmpty() {
        return title == null && description == null && severity == null && category == null
                && evidenceSnippets == null;
    }

    @Nonnull
    public Finding applyTo(@Nonnull Finding finding) {
        Objects.requireNonNull(finding, "finding");
        Finding.Builder builder = finding.toBuilder();
        if (title != null) {
            builder.title(title);
        }
        if (description != null) {
            builder.description(description);
        }
        if (severity != null) {
            builder.severity(severity);
        }
        if (category != null) {
            builder.category(category);
        }
        if (evidenceSnippets != null) {
            builder.evidenceSnippets(evidenceSnippets);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String description;
        private Severity severity;
        private FindingCategory category;
        private List<String> evidenceSnippets;

        public Builder title(@Nullable String value) {
            this.title = blankToNull(value);
            return this;
        }

        public Builder description(@Nullable String value) {
            this.description = blankToNull(value);
            return this;
        }

        public Builder severity(@Nullable Severity value) {
            this.severity = value;
            return this;
        }

        public Builder category(@Nullable FindingCategory value) {
            this.category = value;
            return this;
        }

        public Builder evidenceSnippets(@Nullable List<String> values) {
            this.evidenceSnippets = values;
            return this;
        }

        public FindingEdit build() {
            return new FindingEdit(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.trim().isEmpty() ? null : value;
        }
    }
}
