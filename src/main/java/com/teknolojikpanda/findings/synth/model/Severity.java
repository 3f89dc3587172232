package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Finding severity. Declaration order is rank order: P1 is the most severe.
 * <p>
 * Every constant carries its tracker priority, so the severity to priority mapping is
 * total by construction.
 */
public enum Severity {
    P1(TaskPriority.HIGHEST),
    P2(TaskPriority.MEDIUM),
    P3(TaskPriority.LOWEST);

    private final TaskPriority priority;

    Severity(TaskPriority priority) {
        this.priority = priority;
    }

    @Nonnull
    public TaskPriority toPriority() {
        return priority;
    }

    public int rank() {
        return ordinal() + 1;
    }

    /**
     * Strict parse: only {@code P1}, {@code P2} and {@code P3} (any case, surrounding blanks
     * ignored) are accepted.
     *
     * @return the severity, or {@code null} when the value is not one of the fixed set
     */
    @Nullable
    public static Severity parse(@Nullable String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toUpperCase(Locale.ENGLISH)) {
            case "P1":
                return P1;
            case "P2":
                return P2;
            case "P3":
                return P3;
            default:
                return null;
        }
    }
}
