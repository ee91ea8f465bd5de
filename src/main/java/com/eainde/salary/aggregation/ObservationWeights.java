package com.eainde.salary.aggregation;

import com.eainde.salary.model.Observation;

import java.util.Comparator;

/**
 * Effective weights and the canonical ordering of observations.
 *
 * <p>The canonical order makes every aggregation step independent of the
 * order in which providers returned their data.</p>
 */
final class ObservationWeights {

    private final AggregationSettings settings;

    ObservationWeights(AggregationSettings settings) {
        this.settings = settings;
    }

    double weightOf(Observation observation) {
        double weight;
        if (observation.weightHint() != null) {
            weight = observation.weightHint();
        } else {
            weight = switch (observation.origin()) {
                case KNOWLEDGE_STORE -> settings.getKnowledgeStoreWeight();
                case WEB_SEARCH -> settings.getWebSearchWeight();
            };
        }
        return Math.max(settings.getMinimumWeight(), weight);
    }

    /**
     * Heaviest first, then source, then amounts, then provenance text.
     */
    Comparator<Observation> canonicalOrder() {
        return Comparator.comparingDouble(this::weightOf).reversed()
                .thenComparing(Observation::source)
                .thenComparingLong(Observation::low)
                .thenComparingLong(Observation::high)
                .thenComparing(Observation::currency)
                .thenComparing(Observation::origin)
                .thenComparing(Observation::rawText, Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
