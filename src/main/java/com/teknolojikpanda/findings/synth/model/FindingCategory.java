package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Fixed set of buckets analyzers report findings under.
 */
public enum FindingCategory {
    SECURITY,
    PERFORMANCE,
    PLATFORM_PATTERN,
    DESIGN,
    QUALITY,
    TESTING,
    DOCUMENTATION,
    OTHER;

    @Nonnull
    public static FindingCategory fromString(@Nonnull String value) {
        switch (value.trim().toLowerCase(Locale.ENGLISH).replace('_', '-').replace(' ', '-')) {
            case "security":
            case "secrets":
            case "vulnerability":
                return SECURITY;
            case "performance":
            case "perf":
                return PERFORMANCE;
            case "platform-pattern":
            case "platform":
            case "runtime":
            case "binding":
                return PLATFORM_PATTERN;
            case "design":
            case "architecture":
                return DESIGN;
            case "quality":
            case "maintainability":
            case "style":
            case "bug":
                return QUALITY;
            case "testing":
            case "tests":
                return TESTING;
            case "documentation":
            case "docs":
                return DOCUMENTATION;
            default:
                return OTHER;
        }
    }

    /**
     * Label used when the category is sent to the tracker, e.g. {@code platform-pattern}.
     */
    @Nonnull
    public String label() {
        return name().toLowerCase(Locale.ENGLISH).replace('_', '-');
    }
}
