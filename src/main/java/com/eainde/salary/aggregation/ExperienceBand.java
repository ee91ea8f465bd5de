package com.eainde.salary.aggregation;

/**
 * Years-of-experience bracket, half-open: {@code [minYears, maxYears)}.
 *
 * @param label      seniority name used in the adjustment text
 * @param minYears   inclusive lower bound
 * @param maxYears   exclusive upper bound, or null for open-ended
 * @param adjustment fractional change; zero marks the neutral band
 */
public record ExperienceBand(String label, double minYears, Double maxYears, double adjustment) {

    public boolean contains(double years) {
        return years >= minYears && (maxYears == null || years < maxYears);
    }
}
