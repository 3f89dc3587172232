package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * 1-based inclusive line span a finding points at. A single reported line is a one-line range.
 */
public final class LineRange implements Comparable<LineRange> {

    private final int start;
    private final int end;

    private LineRange(int start, int end) {
        if (start < 1) {
            throw new IllegalArgumentException("start must be >= 1");
        }
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start");
        }
        this.start = start;
        this.end = end;
    }

    public static LineRange of(int start, int end) {
        return new LineRange(start, end);
    }

    public static LineRange singleLine(int line) {
        return new LineRange(line, line);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Two ranges overlap when they share at least one line; coincident ranges overlap.
     */
    public boolean overlaps(@Nonnull LineRange other) {
        Objects.requireNonNull(other, "other");
        return start <= other.end && other.start <= end;
    }

    @Nonnull
    public String asDisplay() {
        return start == end ? String.valueOf(start) : start + "-" + end;
    }

    @Override
    public int compareTo(@Nonnull LineRange other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineRange)) return false;
        LineRange that = (LineRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return asDisplay();
    }
}
