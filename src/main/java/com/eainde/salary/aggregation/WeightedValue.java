package com.eainde.salary.aggregation;

/**
 * A value with a non-negative weight, input to {@link WeightedPercentiles}.
 */
public record WeightedValue(double value, double weight) {
}
