package com.eainde.salary.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Categorical confidence bucket.
 *
 * <p>Buckets are half-open and cover [0,1] exactly:
 * {@code [0, 0.4)} low, {@code [0.4, 0.7)} medium, {@code [0.7, 1]} high.</p>
 */
public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_THRESHOLD = 0.4;
    public static final double HIGH_THRESHOLD = 0.7;

    public static ConfidenceLevel fromScore(double score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
