package com.eainde.salary.aggregation;

import com.eainde.salary.model.Confidence;
import com.eainde.salary.model.Estimate;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.Profile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a bag of salary observations into one adjusted, confidence-scored range.
 *
 * <h3>Steps, in order:</h3>
 * <ol>
 *   <li>Sanitize: drop malformed amounts and non-dominant currencies.</li>
 *   <li>Deduplicate: same source, amounts within tolerance.</li>
 *   <li>Reject outliers by median / MAD of midpoints (skipped for tiny samples).</li>
 *   <li>Weighted percentiles: low end, median, high end.</li>
 *   <li>Profile adjustments: location, company, experience.</li>
 *   <li>Confidence score and templated reasoning.</li>
 * </ol>
 *
 * <p>The result depends only on the set of observations and the profile. Input
 * order is erased by a canonical sort before any step runs, and no step reads
 * a clock, a random source or shared state.</p>
 */
@Slf4j
public class SalaryAggregator {

    private final AggregationSettings settings;
    private final ObservationWeights weights;
    private final ObservationSanitizer sanitizer;
    private final ObservationDeduplicator deduplicator;
    private final OutlierFilter outlierFilter;
    private final ProfileAdjuster adjuster;
    private final ConfidenceScorer scorer;
    private final ReasoningComposer reasoningComposer;

    public SalaryAggregator(AggregationSettings settings) {
        this.settings = settings;
        this.weights = new ObservationWeights(settings);
        this.sanitizer = new ObservationSanitizer(settings);
        this.deduplicator = new ObservationDeduplicator(settings, weights);
        this.outlierFilter = new OutlierFilter(settings);
        this.adjuster = new ProfileAdjuster(settings);
        this.scorer = new ConfidenceScorer(settings);
        this.reasoningComposer = new ReasoningComposer();
    }

    public AggregationSettings getSettings() {
        return settings;
    }

    public AggregationOutcome aggregate(Collection<Observation> observations, Profile profile) {
        List<Observation> canonical = new ArrayList<>(observations == null ? List.of() : observations);
        canonical.sort(weights.canonicalOrder());
        List<String> factors = new ArrayList<>();

        ObservationSanitizer.Result sanitized = sanitizer.sanitize(canonical);
        if (sanitized.malformed() > 0) {
            factors.add("Dropped " + sanitized.malformed() + " malformed observation(s)");
        }
        if (sanitized.foreignCurrency() > 0) {
            factors.add("Ignored " + sanitized.foreignCurrency() + " observation(s) not in " + sanitized.currency());
        }

        List<Observation> unique = deduplicator.deduplicate(sanitized.accepted());
        int merged = sanitized.accepted().size() - unique.size();
        if (merged > 0) {
            factors.add("Merged " + merged + " near-duplicate observation(s)");
        }

        OutlierFilter.Result filtered = outlierFilter.filter(unique);
        if (filtered.skipped() && !unique.isEmpty()) {
            factors.add("Outlier rejection skipped: only " + unique.size() + " data point(s)");
        } else if (filtered.rejected() > 0) {
            factors.add(String.format(Locale.US,
                    "Excluded %d outlier observation(s) beyond %.1f MAD of the %s median",
                    filtered.rejected(), settings.getOutlierMadMultiplier(),
                    ReasoningComposer.amount(Math.round(filtered.median()))));
        }

        List<Observation> accepted = filtered.kept();
        if (accepted.isEmpty()) {
            log.debug("No observations survived filtering ({} collected)", canonical.size());
            return new AggregationOutcome(
                    Estimate.unset(sanitized.currency()),
                    Confidence.none(factors),
                    reasoningComposer.composeEmpty(canonical.size()),
                    List.of(),
                    List.of());
        }

        Estimate unadjusted = weightedEstimate(accepted, sanitized.currency());
        ProfileAdjuster.Result adjusted = adjuster.apply(unadjusted, profile);
        factors.addAll(adjusted.descriptions());

        List<String> sources = distinctSources(accepted);
        double score = scorer.score(accepted.size(), sources.size(), unadjusted);
        Confidence confidence = Confidence.of(score, accepted.size(), factors);
        String reasoning = reasoningComposer.compose(
                accepted.size(), sources, unadjusted, adjusted.descriptions(), adjusted.estimate());

        log.debug("Aggregated {} of {} observations into {} (score {})",
                accepted.size(), canonical.size(), adjusted.estimate(), score);
        return new AggregationOutcome(adjusted.estimate(), confidence, reasoning, sources, adjusted.descriptions());
    }

    private Estimate weightedEstimate(List<Observation> accepted, String currency) {
        List<WeightedValue> lows = new ArrayList<>(accepted.size());
        List<WeightedValue> mids = new ArrayList<>(accepted.size());
        List<WeightedValue> highs = new ArrayList<>(accepted.size());
        for (Observation observation : accepted) {
            double weight = weights.weightOf(observation);
            lows.add(new WeightedValue(observation.low(), weight));
            mids.add(new WeightedValue(observation.midpoint(), weight));
            highs.add(new WeightedValue(observation.high(), weight));
        }
        long min = Math.round(WeightedPercentiles.percentile(lows, settings.getLowPercentile()));
        long median = Math.round(WeightedPercentiles.percentile(mids, 0.5));
        long max = Math.round(WeightedPercentiles.percentile(highs, settings.getHighPercentile()));
        return Estimate.of(currency, min, median, max);
    }

    private static List<String> distinctSources(List<Observation> accepted) {
        Set<String> sources = new LinkedHashSet<>();
        for (Observation observation : accepted) {
            sources.add(observation.source());
        }
        return List.copyOf(sources);
    }
}
