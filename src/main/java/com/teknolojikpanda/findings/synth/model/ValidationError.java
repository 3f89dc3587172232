package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Why a single analyzer payload was rejected by the ingestor.
 */
public final class ValidationError {

    private final String analyzerId;
    private final int payloadIndex;
    private final String field;
    private final String message;

    public ValidationError(@Nonnull String analyzerId, int payloadIndex, @Nonnull String field, @Nonnull String message) {
        this.analyzerId = Objects.requireNonNull(analyzerId, "analyzerId");
        this.payloadIndex = payloadIndex;
        this.field = Objects.requireNonNull(field, "field");
        this.message = Objects.requireNonNull(message, "message");
    }

    @Nonnull
    public String getAnalyzerId() {
        return analyzerId;
    }

    /**
     * Zero-based position of the payload in the analyzer's batch.
     */
    public int getPayloadIndex() {
        return payloadIndex;
    }

    @Nonnull
    public String getField() {
        return field;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return payloadIndex == that.payloadIndex
                && analyzerId.equals(that.analyzerId)
                && field.equals(that.field)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(analyzerId, payloadIndex, field, message);
    }

    @Override
    public String toString() {
        return analyzerId + "[" + payloadIndex + "]." + field + ": " + message;
    }
}
