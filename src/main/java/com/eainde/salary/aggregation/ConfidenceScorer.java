package com.eainde.salary.aggregation;

import com.eainde.salary.model.Estimate;

/**
 * Scores how much an estimate can be trusted.
 *
 * <pre>
 * score = countWeight     * (1 - exp(-n / countScale))
 *       + diversityWeight * min(1, distinctSources / diversityTarget)
 *       + spreadWeight    * clamp(1 - ((max - min) / median) / spreadCeiling, 0, 1)
 * </pre>
 * clamped to [0,1] and rounded to two decimals. Every term is non-decreasing
 * in its own input, so more data points never lower the score.
 */
public final class ConfidenceScorer {

    private final AggregationSettings settings;

    public ConfidenceScorer(AggregationSettings settings) {
        this.settings = settings;
    }

    public double score(int dataPoints, int distinctSources, Estimate unadjusted) {
        if (dataPoints <= 0 || unadjusted == null || !unadjusted.isSet()) {
            return 0.0;
        }
        double raw = settings.getCountWeight() * countComponent(dataPoints)
                + settings.getDiversityWeight() * diversityComponent(distinctSources)
                + settings.getSpreadWeight() * spreadComponent(unadjusted);
        double clamped = Math.max(0.0, Math.min(1.0, raw));
        return Math.round(clamped * 100.0) / 100.0;
    }

    double countComponent(int dataPoints) {
        return 1.0 - Math.exp(-dataPoints / settings.getCountScale());
    }

    double diversityComponent(int distinctSources) {
        if (settings.getDiversityTarget() <= 0) {
            return 1.0;
        }
        return Math.min(1.0, distinctSources / (double) settings.getDiversityTarget());
    }

    double spreadComponent(Estimate estimate) {
        if (estimate.median() <= 0) {
            return 0.0;
        }
        double relativeSpread = (estimate.max() - estimate.min()) / (double) estimate.median();
        return Math.max(0.0, Math.min(1.0, 1.0 - relativeSpread / settings.getSpreadCeiling()));
    }
}
