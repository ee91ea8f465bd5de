package com.eainde.salary.provider.knowledge;

import com.eainde.salary.aggregation.AggregationSettings;
import com.eainde.salary.model.Observation;
import com.eainde.salary.model.ObservationOrigin;
import com.eainde.salary.model.Profile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BenchmarkKnowledgeStoreProviderTest {

    private static SalaryBenchmark benchmark(String role, String location, String tier,
                                             int yoeMin, int yoeMax, long min, long max) {
        return new SalaryBenchmark(role, location, tier, yoeMin, yoeMax, min, max, (min + max) / 2,
                "USD", "internal_kb", 2024);
    }

    private static final List<SalaryBenchmark> BENCHMARKS = List.of(
            benchmark("Software Engineer", "Austin, TX", "tier2", 2, 5, 120_000, 170_000),
            benchmark("Staff Software Engineer", "San Francisco, CA", "faang", 8, 12, 350_000, 550_000),
            benchmark("Senior Software Engineer", "San Francisco, CA", "tier1", 5, 8, 230_000, 360_000),
            benchmark("Staff Software Engineer", "New York, NY", "tier1", 8, 12, 300_000, 450_000),
            benchmark("Product Manager", "San Francisco, CA", "faang", 3, 7, 190_000, 310_000),
            benchmark("Junior Software Engineer", "San Francisco, CA", "faang", 0, 1, 140_000, 180_000));

    private final BenchmarkKnowledgeStoreProvider provider = new BenchmarkKnowledgeStoreProvider(
            new SalaryBenchmarkRepository(BENCHMARKS),
            AggregationSettings.DEFAULT_LOCATION_TIERS,
            AggregationSettings.DEFAULT_COMPANY_TIERS,
            5, 2);

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("should rank by title overlap, then location, then company tier")
        void ranking() {
            List<Observation> observations = provider.lookup(
                    Profile.of("Staff Software Engineer", "Meta", 9.0, "Menlo Park, CA"));

            assertThat(observations).extracting(Observation::low)
                    .containsExactly(350_000L, 300_000L, 230_000L);
        }

        @Test
        @DisplayName("should skip benchmarks outside the widened experience window")
        void experienceWindow() {
            List<Observation> observations = provider.lookup(
                    Profile.of("Software Engineer", null, 7.0, "Austin, TX"));

            assertThat(observations).extracting(Observation::low)
                    .containsExactly(120_000L, 350_000L, 230_000L, 300_000L);
        }

        @Test
        @DisplayName("should ignore experience when it is unknown")
        void unknownExperience() {
            assertThat(provider.lookup(Profile.of("Product Manager", null, null, null)))
                    .extracting(Observation::low).containsExactly(190_000L);
        }

        @Test
        @DisplayName("should cap the number of matches")
        void cap() {
            BenchmarkKnowledgeStoreProvider capped = new BenchmarkKnowledgeStoreProvider(
                    new SalaryBenchmarkRepository(BENCHMARKS),
                    AggregationSettings.DEFAULT_LOCATION_TIERS,
                    AggregationSettings.DEFAULT_COMPANY_TIERS,
                    1, 2);

            assertThat(capped.lookup(Profile.of("Staff Software Engineer", "Meta", 9.0, "San Francisco")))
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("Observations")
    class Observations {

        @Test
        @DisplayName("should emit range observations without a weight hint")
        void shape() {
            Observation observation = provider.lookup(Profile.of("Product Manager", null, 4.0, null)).get(0);

            assertThat(observation.low()).isEqualTo(190_000L);
            assertThat(observation.high()).isEqualTo(310_000L);
            assertThat(observation.source()).isEqualTo("internal_kb");
            assertThat(observation.origin()).isEqualTo(ObservationOrigin.KNOWLEDGE_STORE);
            assertThat(observation.weightHint()).isNull();
            assertThat(observation.rawText()).contains("Product Manager", "San Francisco, CA", "$190,000-$310,000");
        }

        @Test
        @DisplayName("should return nothing without a title or for an unrelated title")
        void noMatch() {
            assertThat(provider.lookup(Profile.of(null, "Meta", 9.0, "San Francisco"))).isEmpty();
            assertThat(provider.lookup(Profile.of("Head Chef", null, 9.0, null))).isEmpty();
            assertThat(provider.lookup(null)).isEmpty();
        }
    }
}
