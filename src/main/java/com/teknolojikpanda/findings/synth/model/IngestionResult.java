package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Normalized findings together with the payloads that were rejected.
 */
public final class IngestionResult {

    private final List<Finding> findings;
    private final List<ValidationError> errors;

    public IngestionResult(@Nonnull List<Finding> findings, @Nonnull List<ValidationError> errors) {
        this.findings = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(findings, "findings")));
        this.errors = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(errors, "errors")));
    }

    @Nonnull
    public List<Finding> getFindings() {
        return findings;
    }

    @Nonnull
    public List<ValidationError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Nonnull
    public IngestionResult plus(@Nonnull IngestionResult other) {
        List<Finding> mergedFindings = new ArrayList<>(findings);
        mergedFindings.addAll(other.findings);
        List<ValidationError> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        return new IngestionResult(mergedFindings, mergedErrors);
    }

    @Nonnull
    public static IngestionResult empty() {
        return new IngestionResult(Collections.emptyList(), Collections.emptyList());
    }
}
