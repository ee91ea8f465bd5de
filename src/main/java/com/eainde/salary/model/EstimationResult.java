package com.eainde.salary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * Final output of one estimation run. Field names are the external contract.
 *
 * @param profileSummary the extracted profile, as echoed back
 * @param salaryEstimate the range; all figures null when no data survived
 * @param confidence     score, level, data point count and factors
 * @param reasoning      templated summary of how the figure was reached
 * @param sources        distinct sources of the accepted observations, first seen first
 * @param adjustments    profile-driven adjustments, each also present in confidence factors
 */
@JsonPropertyOrder({"profile_summary", "salary_estimate", "confidence", "reasoning", "sources", "adjustments"})
public record EstimationResult(
        @JsonProperty("profile_summary") ProfileSummary profileSummary,
        @JsonProperty("salary_estimate") Estimate salaryEstimate,
        @JsonProperty("confidence")      Confidence confidence,
        @JsonProperty("reasoning")       String reasoning,
        @JsonProperty("sources")         List<String> sources,
        @JsonProperty("adjustments")     List<String> adjustments
) implements Serializable {

    public EstimationResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
        if (confidence != null && !confidence.factors().containsAll(adjustments)) {
            throw new IllegalArgumentException("Every adjustment must also be a confidence factor");
        }
    }
}
