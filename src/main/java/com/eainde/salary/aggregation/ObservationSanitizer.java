package com.eainde.salary.aggregation;

import com.eainde.salary.model.Observation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Drops malformed observations and those outside the dominant currency.
 * Runs before deduplication, so nothing dropped here reaches outlier logic.
 */
@Slf4j
final class ObservationSanitizer {

    /**
     * @param accepted          observations that passed both checks
     * @param currency          currency of the accepted set
     * @param malformed         count of non-positive, inverted or absurd amounts
     * @param foreignCurrency   count of observations in a non-dominant currency
     */
    record Result(List<Observation> accepted, String currency, int malformed, int foreignCurrency) {
    }

    private final AggregationSettings settings;

    ObservationSanitizer(AggregationSettings settings) {
        this.settings = settings;
    }

    Result sanitize(List<Observation> observations) {
        List<Observation> wellFormed = new ArrayList<>();
        int malformed = 0;
        for (Observation observation : observations) {
            if (isMalformed(observation)) {
                log.debug("Dropping malformed observation {} - {} from {}",
                        observation.low(), observation.high(), observation.source());
                malformed++;
            } else {
                wellFormed.add(observation);
            }
        }

        String currency = dominantCurrency(wellFormed);
        List<Observation> accepted = new ArrayList<>();
        int foreign = 0;
        for (Observation observation : wellFormed) {
            if (observation.currency().equals(currency)) {
                accepted.add(observation);
            } else {
                foreign++;
            }
        }
        return new Result(accepted, currency, malformed, foreign);
    }

    private boolean isMalformed(Observation observation) {
        return observation.low() <= 0
                || observation.high() <= 0
                || observation.low() > observation.high()
                || observation.high() > settings.getSanityCeiling();
    }

    /**
     * Most frequent currency; ties go to the configured default, then alphabetical order.
     */
    private String dominantCurrency(List<Observation> observations) {
        if (observations.isEmpty()) {
            return settings.getDefaultCurrency();
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (Observation observation : observations) {
            counts.merge(observation.currency(), 1, Integer::sum);
        }
        int best = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (counts.getOrDefault(settings.getDefaultCurrency(), 0) == best) {
            return settings.getDefaultCurrency();
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == best) {
                return entry.getKey();
            }
        }
        return settings.getDefaultCurrency();
    }
}
