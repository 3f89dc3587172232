package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Answer a decision provider gives for the finding currently presented.
 */
public final class TriageResponse {

    public enum Action {
        ACCEPT,
        SKIP,
        EDIT
    }

    private static final TriageResponse ACCEPT = new TriageResponse(Action.ACCEPT, null);
    private static final TriageResponse SKIP = new TriageResponse(Action.SKIP, null);

    private final Action action;
    private final FindingEdit edit;

    private TriageResponse(Action action, FindingEdit edit) {
        this.action = action;
        this.edit = edit;
    }

    public static TriageResponse accept() {
        return ACCEPT;
    }

    public static TriageResponse skip() {
        return SKIP;
    }

    public static TriageResponse edit(@Nonnull FindingEdit edit) {
        return new TriageResponse(Action.EDIT, Objects.requireNonNull(edit, "edit"));
    }

    @Nonnull
    public Action getAction() {
        return action;
    }

    @Nullable
    public FindingEdit getEdit() {
        return edit;
    }

    @Override
    public String toString() {
        return action.name();
    }
}
