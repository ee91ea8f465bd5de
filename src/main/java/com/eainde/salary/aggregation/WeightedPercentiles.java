package com.eainde.salary.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Weighted quantiles and the robust statistics used for outlier rejection.
 */
public final class WeightedPercentiles {

    private static final double EPSILON = 1e-9;

    private WeightedPercentiles() {
    }

    /**
     * Lower step quantile: the smallest value whose cumulative weight reaches
     * {@code p * totalWeight}. Monotone in the inputs, so if every value of one
     * sample is below its counterpart in another sample with the same weights,
     * its percentile is too.
     *
     * @param values   weighted values, any order
     * @param p        percentile in [0,1]
     * @return the percentile value
     * @throws IllegalArgumentException if {@code values} is empty or all weights are zero
     */
    public static double percentile(List<WeightedValue> values, double p) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty sample");
        }
        if (p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException("Percentile must be within [0,1]: " + p);
        }
        List<WeightedValue> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparingDouble(WeightedValue::value));

        double total = 0.0;
        for (WeightedValue v : sorted) {
            total += Math.max(0.0, v.weight());
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("Total weight must be positive");
        }

        double target = p * total;
        double cumulative = 0.0;
        for (WeightedValue v : sorted) {
            cumulative += Math.max(0.0, v.weight());
            if (v.weight() > 0.0 && cumulative >= target - EPSILON) {
                return v.value();
            }
        }
        return sorted.get(sorted.size() - 1).value();
    }

    /**
     * Plain median; an even-sized sample takes the mean of the middle pair.
     */
    public static double median(List<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot take the median of an empty sample");
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    /**
     * Median absolute deviation around {@code center}.
     */
    public static double medianAbsoluteDeviation(List<Double> values, double center) {
        List<Double> deviations = new ArrayList<>(values.size());
        for (Double v : values) {
            deviations.add(Math.abs(v - center));
        }
        return median(deviations);
    }
}
