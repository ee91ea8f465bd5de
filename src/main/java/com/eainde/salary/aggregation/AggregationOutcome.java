package com.eainde.salary.aggregation;

import com.eainde.salary.model.Confidence;
import com.eainde.salary.model.Estimate;

import java.io.Serializable;
import java.util.List;

/**
 * Everything {@link SalaryAggregator} produces for one observation set.
 *
 * @param estimate    the adjusted range, unset when nothing survived filtering
 * @param confidence  score, level, data points and ordered factors
 * @param reasoning   templated explanation
 * @param sources     distinct accepted sources, first seen first
 * @param adjustments adjustment lines, a subset of {@code confidence.factors()}
 */
public record AggregationOutcome(
        Estimate estimate,
        Confidence confidence,
        String reasoning,
        List<String> sources,
        List<String> adjustments
) implements Serializable {

    public AggregationOutcome {
        sources = sources == null ? List.of() : List.copyOf(sources);
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }

    public boolean hasEstimate() {
        return estimate != null && estimate.isSet();
    }

    /**
     * Appends a sentence to the reasoning, leaving every other field untouched.
     */
    public AggregationOutcome withReasoningNote(String note) {
        if (note == null || note.isBlank()) {
            return this;
        }
        return new AggregationOutcome(estimate, confidence, reasoning + " " + note.trim(), sources, adjustments);
    }
}
