package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What is being reviewed, e.g. {@code PR #42} or a local branch. Attributes are opaque to the
 * engine and handed to analyzers unchanged.
 */
public final class ReviewTarget {

    private final String reference;
    private final Map<String, String> attributes;

    private ReviewTarget(String reference, Map<String, String> attributes) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ReviewTarget of(@Nonnull String reference) {
        return new ReviewTarget(reference, Collections.emptyMap());
    }

    public static ReviewTarget of(@Nonnull String reference, @Nonnull Map<String, String> attributes) {
        return new ReviewTarget(reference, Objects.requireNonNull(attributes, "attributes"));
    }

    @Nonnull
    public String getReference() {
        return reference;
    }

    @Nonnull
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return reference;
    }
}
