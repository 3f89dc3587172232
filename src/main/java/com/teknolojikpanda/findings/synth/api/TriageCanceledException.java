package com.teknolojikpanda.findings.synth.api;

import javax.annotation.Nullable;

/**
 * Thrown by a decision provider when the reviewer abandons the triage session. The session
 * catches it and marks itself incomplete; it never escapes to the caller.
 */
public class TriageCanceledException extends RuntimeException {

    private final String sessionId;

    public TriageCanceledException(@Nullable String sessionId, @Nullable String message) {
        super(message != null ? message : "Triage canceled by reviewer.");
        this.sessionId = sessionId;
    }

    @Nullable
    public String getSessionId() {
        return sessionId;
    }
}
