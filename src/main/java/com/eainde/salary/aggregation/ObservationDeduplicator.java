package com.eainde.salary.aggregation;

import com.eainde.salary.model.Observation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collapses near-identical observations from the same source.
 *
 * <p>Observations are visited by source and ascending amount. Each one joins
 * the first cluster of its source whose anchor (the cluster's first member)
 * has both low and high within the relative tolerance; otherwise it starts a
 * new cluster. A cluster keeps its heaviest member.</p>
 */
final class ObservationDeduplicator {

    private final AggregationSettings settings;
    private final ObservationWeights weights;

    ObservationDeduplicator(AggregationSettings settings, ObservationWeights weights) {
        this.settings = settings;
        this.weights = weights;
    }

    List<Observation> deduplicate(List<Observation> observations) {
        List<Observation> ordered = new ArrayList<>(observations);
        ordered.sort(Comparator.comparing(Observation::source)
                .thenComparingLong(Observation::low)
                .thenComparingLong(Observation::high)
                .thenComparing(weights.canonicalOrder()));

        List<Cluster> clusters = new ArrayList<>();
        for (Observation observation : ordered) {
            Cluster home = null;
            for (Cluster cluster : clusters) {
                if (cluster.accepts(observation)) {
                    home = cluster;
                    break;
                }
            }
            if (home == null) {
                clusters.add(new Cluster(observation));
            } else {
                home.offer(observation);
            }
        }

        List<Observation> kept = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            kept.add(cluster.best);
        }
        kept.sort(weights.canonicalOrder());
        return kept;
    }

    private boolean withinTolerance(long a, long b) {
        long larger = Math.max(Math.abs(a), Math.abs(b));
        if (larger == 0) {
            return true;
        }
        return Math.abs(a - b) / (double) larger <= settings.getDedupTolerance();
    }

    private final class Cluster {
        private final Observation anchor;
        private Observation best;

        Cluster(Observation anchor) {
            this.anchor = anchor;
            this.best = anchor;
        }

        boolean accepts(Observation candidate) {
            return anchor.source().equals(candidate.source())
                    && withinTolerance(anchor.low(), candidate.low())
                    && withinTolerance(anchor.high(), candidate.high());
        }

        void offer(Observation candidate) {
            if (weights.weightOf(candidate) > weights.weightOf(best)) {
                best = candidate;
            }
        }
    }
}
