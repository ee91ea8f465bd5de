package com.eainde.salary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * Confidence attached to an {@link Estimate}.
 *
 * @param score      value in [0,1]
 * @param level      bucket derived from {@code score}
 * @param dataPoints observations actually used after filtering
 * @param factors    explanations in the order they were produced
 */
@JsonPropertyOrder({"score", "level", "data_points", "factors"})
public record Confidence(
        @JsonProperty("score")       double score,
        @JsonProperty("level")       ConfidenceLevel level,
        @JsonProperty("data_points") int dataPoints,
        @JsonProperty("factors")     List<String> factors
) implements Serializable {

    public Confidence {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Confidence score must be within [0,1]: " + score);
        }
        if (level != ConfidenceLevel.fromScore(score)) {
            throw new IllegalArgumentException("Level " + level + " does not match score " + score);
        }
        if (dataPoints < 0) {
            throw new IllegalArgumentException("dataPoints must be non-negative");
        }
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public static Confidence of(double score, int dataPoints, List<String> factors) {
        return new Confidence(score, ConfidenceLevel.fromScore(score), dataPoints, factors);
    }

    public static Confidence none(List<String> factors) {
        return of(0.0, 0, factors);
    }
}
