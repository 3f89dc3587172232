package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Named trust signals captured on a finding at ingestion time.
 */
public enum ConfidenceSignal {

    /** File and line are both present. Derived from the payload. */
    LOCATED(Kind.EVIDENCE, "locationPresent", true),
    /** A quoted code/content excerpt is attached. Derived from the payload. */
    QUOTED_EXCERPT(Kind.EVIDENCE, "quotedExcerpt", true),
    /** The finding concerns content changed versus the baseline. */
    CHANGED_CONTENT(Kind.EVIDENCE, "changedContent", false),
    /** The finding names a specific documented rule it violates. */
    DOCUMENTED_RULE(Kind.EVIDENCE, "documentedRule", false),

    /** The finding concerns unchanged baseline content. */
    BASELINE_CONTENT(Kind.FALSE_POSITIVE, "unchangedContent", false),
    /** A cheaper deterministic check would already catch this. */
    DETERMINISTIC_CHECK(Kind.FALSE_POSITIVE, "cheaperCheckAvailable", false),
    /** The code carries an explicit suppression marker. */
    SUPPRESSED(Kind.FALSE_POSITIVE, "suppressionMarker", false),
    /** Subjective style preference rather than a defect. */
    STYLE_PREFERENCE(Kind.FALSE_POSITIVE, "stylePreference", false);

    public enum Kind {
        EVIDENCE,
        FALSE_POSITIVE
    }

    private final Kind kind;
    private final String key;
    private final boolean derived;

    ConfidenceSignal(Kind kind, String key, boolean derived) {
        this.kind = kind;
        this.key = key;
        this.derived = derived;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Name used in the analyzer output contract.
     */
    @Nonnull
    public String getKey() {
        return key;
    }

    /**
     * Derived signals are computed from the payload shape; declared values for them are ignored.
     */
    public boolean isDerived() {
        return derived;
    }

    public boolean isEvidence() {
        return kind == Kind.EVIDENCE;
    }

    /**
     * Resolves a declared signal name. Matching ignores case, dashes and underscores and also
     * accepts the enum constant name.
     */
    @Nullable
    public static ConfidenceSignal fromKey(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = normalize(value);
        for (ConfidenceSignal signal : values()) {
            if (normalize(signal.key).equals(normalized) || normalize(signal.name()).equals(normalized)) {
                return signal;
            }
        }
        return null;
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ENGLISH).replace("_", "").replace("-", "");
    }
}
