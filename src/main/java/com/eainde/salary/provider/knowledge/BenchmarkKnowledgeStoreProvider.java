package com.eainde.salary.provider.knowledge;

import com.eainde.salary.aggregation.CompanyTier;
import com.eainde.salary.aggregation.LocationTier;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.ObservationOrigin;
import com.eainde.salary.model.Profile;
import com.eainde.salary.provider.KnowledgeStoreObservationProvider;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structured lookup of curated benchmarks by profile facts.
 *
 * <p>A benchmark is a candidate when its role shares at least one meaningful
 * word with the profile title and, if experience is known, the experience
 * falls within its window widened by the configured slack. Candidates are
 * ranked by title overlap, then location match, then company tier match.</p>
 */
@Log4j2
public class BenchmarkKnowledgeStoreProvider implements KnowledgeStoreObservationProvider {

    private static final Set<String> STOP_WORDS = Set.of("of", "and", "the", "at", "for", "in", "a", "an", "&", "i", "ii", "iii");
    private static final int TITLE_WEIGHT = 3;
    private static final int LOCATION_WEIGHT = 2;
    private static final int TIER_WEIGHT = 1;

    private final SalaryBenchmarkRepository repository;
    private final List<LocationTier> locationTiers;
    private final List<CompanyTier> companyTiers;
    private final int maxMatches;
    private final int experienceSlack;

    public BenchmarkKnowledgeStoreProvider(SalaryBenchmarkRepository repository,
                                           List<LocationTier> locationTiers,
                                           List<CompanyTier> companyTiers,
                                           int maxMatches,
                                           int experienceSlack) {
        this.repository = repository;
        this.locationTiers = List.copyOf(locationTiers);
        this.companyTiers = List.copyOf(companyTiers);
        this.maxMatches = maxMatches;
        this.experienceSlack = experienceSlack;
    }

    private record Candidate(SalaryBenchmark benchmark, int index, int score) {
    }

    @Override
    public List<Observation> lookup(Profile profile) {
        if (profile == null || !profile.hasTitle()) {
            return List.of();
        }
        Set<String> titleWords = words(profile.title());
        String profileTier = companyTierOf(profile.company());

        List<Candidate> candidates = new ArrayList<>();
        List<SalaryBenchmark> all = repository.findAll();
        for (int i = 0; i < all.size(); i++) {
            SalaryBenchmark benchmark = all.get(i);
            if (!experienceFits(benchmark, profile)) {
                continue;
            }
            Set<String> overlap = new HashSet<>(words(benchmark.role()));
            overlap.retainAll(titleWords);
            if (overlap.isEmpty()) {
                continue;
            }
            int score = TITLE_WEIGHT * overlap.size();
            if (locationMatches(benchmark.location(), profile.location())) {
                score += LOCATION_WEIGHT;
            }
            if (profileTier != null && profileTier.equalsIgnoreCase(benchmark.companyTier())) {
                score += TIER_WEIGHT;
            }
            candidates.add(new Candidate(benchmark, i, score));
        }

        candidates.sort(Comparator.comparingInt(Candidate::score).reversed()
                .thenComparingInt(Candidate::index));

        List<Observation> observations = candidates.stream()
                .limit(maxMatches)
                .map(c -> toObservation(c.benchmark()))
                .collect(Collectors.toList());
        log.info("Knowledge store: {} candidates, returning {} benchmarks", candidates.size(), observations.size());
        return observations;
    }

    private boolean experienceFits(SalaryBenchmark benchmark, Profile profile) {
        if (!profile.hasYearsOfExperience()) {
            return true;
        }
        double years = profile.yearsOfExperience();
        return benchmark.yearsOfExperienceMin() - experienceSlack <= years
                && years <= benchmark.yearsOfExperienceMax() + experienceSlack;
    }

    private boolean locationMatches(String benchmarkLocation, String profileLocation) {
        if (benchmarkLocation == null || profileLocation == null) {
            return false;
        }
        for (LocationTier tier : locationTiers) {
            if (tier.matches(benchmarkLocation) && tier.matches(profileLocation)) {
                return true;
            }
        }
        String city = benchmarkLocation.split(",")[0].trim().toLowerCase(Locale.ROOT);
        return !city.isEmpty() && profileLocation.toLowerCase(Locale.ROOT).contains(city);
    }

    private String companyTierOf(String company) {
        if (company == null) {
            return null;
        }
        for (CompanyTier tier : companyTiers) {
            if (tier.matches(company)) {
                return tier.code();
            }
        }
        return null;
    }

    private static Observation toObservation(SalaryBenchmark benchmark) {
        String description = String.format(Locale.US,
                "%s at %s company in %s: $%,d-$%,d (median $%,d) for %d-%d YOE (%d)",
                benchmark.role(), benchmark.companyTier(), benchmark.location(),
                benchmark.salaryMin(), benchmark.salaryMax(), benchmark.salaryMedian(),
                benchmark.yearsOfExperienceMin(), benchmark.yearsOfExperienceMax(), benchmark.year());
        return new Observation(benchmark.salaryMin(), benchmark.salaryMax(), benchmark.currency(),
                benchmark.source(), ObservationOrigin.KNOWLEDGE_STORE, null, description);
    }

    static Set<String> words(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9+#]+"))
                .filter(w -> !w.isBlank() && !STOP_WORDS.contains(w))
                .collect(Collectors.toSet());
    }
}
