package com.eainde.salary.aggregation;

import com.eainde.salary.model.Observation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Median / MAD outlier rejection on observation midpoints.
 */
@Slf4j
final class OutlierFilter {

    /**
     * @param kept     surviving observations, input order preserved
     * @param rejected number of observations discarded
     * @param skipped  true when the sample was too small to judge
     * @param median   midpoint median of the input, or NaN when skipped
     */
    record Result(List<Observation> kept, int rejected, boolean skipped, double median) {
    }

    private final AggregationSettings settings;

    OutlierFilter(AggregationSettings settings) {
        this.settings = settings;
    }

    Result filter(List<Observation> observations) {
        if (observations.size() < settings.getMinSampleForOutliers()) {
            return new Result(List.copyOf(observations), 0, true, Double.NaN);
        }

        List<Double> midpoints = new ArrayList<>(observations.size());
        for (Observation observation : observations) {
            midpoints.add(observation.midpoint());
        }
        double median = WeightedPercentiles.median(midpoints);
        double mad = WeightedPercentiles.medianAbsoluteDeviation(midpoints, median);
        double threshold = Math.max(
                settings.getOutlierMadMultiplier() * settings.getMadNormalConstant() * mad,
                settings.getOutlierMinRelativeDeviation() * median);

        List<Observation> kept = new ArrayList<>(observations.size());
        int rejected = 0;
        for (Observation observation : observations) {
            if (Math.abs(observation.midpoint() - median) > threshold) {
                log.debug("Rejecting outlier {} from {} (median {}, threshold {})",
                        observation.midpoint(), observation.source(), median, threshold);
                rejected++;
            } else {
                kept.add(observation);
            }
        }
        return new Result(kept, rejected, false, median);
    }
}
