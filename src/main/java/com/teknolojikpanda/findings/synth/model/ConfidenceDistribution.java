package com.teknolojikpanda.findings.synth.model;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counts of scored findings per confidence bucket: 90-100, 80-89 and below 80.
 */
public final class ConfidenceDistribution {

    public static final String HIGH = "90-100";
    public static final String MEDIUM = "80-89";
    public static final String LOW = "<80";

    private final int high;
    private final int medium;
    private final int low;

    private ConfidenceDistribution(int high, int medium, int low) {
        this.high = high;
        this.medium = medium;
        this.low = low;
    }

    @Nonnull
    public static ConfidenceDistribution of(@Nonnull Collection<Finding> findings) {
        Objects.requireNonNull(findings, "findings");
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Finding finding : findings) {
            int confidence = finding.getConfidence();
            if (confidence >= 90) {
                high++;
            } else if (confidence >= 80) {
                medium++;
            } else {
                low++;
            }
        }
        return new ConfidenceDistribution(high, medium, low);
    }

    public int getHigh() {
        return high;
    }

    public int getMedium() {
        return medium;
    }

    public int getLow() {
        return low;
    }

    public int total() {
        return high + medium + low;
    }

    /**
     * Bucket label to count, highest bucket first.
     */
    @Nonnull
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put(HIGH, high);
        map.put(MEDIUM, medium);
        map.put(LOW, low);
        return map;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
