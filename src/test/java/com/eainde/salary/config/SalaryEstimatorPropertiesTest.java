package com.eainde.salary.config;

import com.eainde.salary.aggregation.AggregationSettings;
import com.eainde.salary.aggregation.CompanyTier;
import com.eainde.salary.aggregation.ExperienceBand;
import com.eainde.salary.aggregation.LocationTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binds the {@code salary.*} tree the way Spring Boot does at startup.
 */
class SalaryEstimatorPropertiesTest {

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(SalaryEstimatorProperties.class)
    static class PropertiesOnly {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesOnly.class);

    @Nested
    @DisplayName("Aggregation settings")
    class Aggregation {

        @Test
        @DisplayName("should fall back to the built-in settings when nothing is configured")
        void defaults() {
            contextRunner.run(context -> {
                SalaryEstimatorProperties properties = context.getBean(SalaryEstimatorProperties.class);

                AggregationSettings settings = properties.getAggregation().toSettings(properties.getAdjustments());

                assertThat(settings).isEqualTo(AggregationSettings.defaults());
            });
        }

        @Test
        @DisplayName("should carry overridden constants into the settings")
        void overrides() {
            contextRunner
                    .withPropertyValues(
                            "salary.aggregation.default-currency=EUR",
                            "salary.aggregation.outlier-mad-multiplier=2.5",
                            "salary.aggregation.min-sample-for-outliers=5",
                            "salary.aggregation.web-search-weight=0.4")
                    .run(context -> {
                        SalaryEstimatorProperties properties = context.getBean(SalaryEstimatorProperties.class);

                        AggregationSettings settings =
                                properties.getAggregation().toSettings(properties.getAdjustments());

                        assertThat(settings.getDefaultCurrency()).isEqualTo("EUR");
                        assertThat(settings.getOutlierMadMultiplier()).isEqualTo(2.5);
                        assertThat(settings.getMinSampleForOutliers()).isEqualTo(5);
                        assertThat(settings.getWebSearchWeight()).isEqualTo(0.4);
                        assertThat(settings.getKnowledgeStoreWeight()).isEqualTo(0.9);
                        assertThat(settings.getLocationTiers()).isEqualTo(AggregationSettings.DEFAULT_LOCATION_TIERS);
                    });
        }
    }

    @Nested
    @DisplayName("Adjustment tables")
    class Adjustments {

        @Test
        @DisplayName("should bind tier and band lists and replace the built-in tables")
        void tables() {
            contextRunner
                    .withPropertyValues(
                            "salary.adjustments.locations[0].label=Berlin",
                            "salary.adjustments.locations[0].adjustment=0.05",
                            "salary.adjustments.locations[0].keywords[0]=berlin",
                            "salary.adjustments.companies[0].code=enterprise",
                            "salary.adjustments.companies[0].label=enterprise software",
                            "salary.adjustments.companies[0].adjustment=0.08",
                            "salary.adjustments.companies[0].companies=SAP,Oracle",
                            "salary.adjustments.experience[0].label=early",
                            "salary.adjustments.experience[0].min-years=0",
                            "salary.adjustments.experience[0].max-years=4",
                            "salary.adjustments.experience[0].adjustment=-0.05",
                            "salary.adjustments.experience[1].label=seasoned",
                            "salary.adjustments.experience[1].min-years=4",
                            "salary.adjustments.experience[1].adjustment=0.1")
                    .run(context -> {
                        SalaryEstimatorProperties properties = context.getBean(SalaryEstimatorProperties.class);

                        AggregationSettings settings =
                                properties.getAggregation().toSettings(properties.getAdjustments());

                        assertThat(settings.getLocationTiers())
                                .containsExactly(new LocationTier("Berlin", 0.05, List.of("berlin")));
                        assertThat(settings.getCompanyTiers()).containsExactly(
                                new CompanyTier("enterprise", "enterprise software", 0.08, List.of("SAP", "Oracle")));
                        assertThat(settings.getExperienceBands()).containsExactly(
                                new ExperienceBand("early", 0, 4.0, -0.05),
                                new ExperienceBand("seasoned", 4, null, 0.1));
                    });
        }

        @Test
        @DisplayName("should keep the built-in tables that are not overridden")
        void partialOverride() {
            contextRunner
                    .withPropertyValues(
                            "salary.adjustments.locations[0].label=Berlin",
                            "salary.adjustments.locations[0].adjustment=0.05",
                            "salary.adjustments.locations[0].keywords[0]=berlin")
                    .run(context -> {
                        SalaryEstimatorProperties.Adjustments adjustments =
                                context.getBean(SalaryEstimatorProperties.class).getAdjustments();

                        assertThat(adjustments.effectiveLocations()).hasSize(1);
                        assertThat(adjustments.effectiveCompanies()).isEqualTo(AggregationSettings.DEFAULT_COMPANY_TIERS);
                        assertThat(adjustments.effectiveExperience()).isEqualTo(AggregationSettings.DEFAULT_EXPERIENCE_BANDS);
                    });
        }
    }

    @Test
    @DisplayName("should bind durations and provider settings")
    void pipelineAndProviders() {
        contextRunner
                .withPropertyValues(
                        "salary.pipeline.branch-timeout=750ms",
                        "salary.search.max-attempts=3",
                        "salary.search.enabled=false",
                        "salary.knowledge.max-matches=2",
                        "salary.query.use-llm=false")
                .run(context -> {
                    SalaryEstimatorProperties properties = context.getBean(SalaryEstimatorProperties.class);

                    assertThat(properties.getPipeline().getBranchTimeout()).isEqualTo(Duration.ofMillis(750));
                    assertThat(properties.getSearch().getMaxAttempts()).isEqualTo(3);
                    assertThat(properties.getSearch().isEnabled()).isFalse();
                    assertThat(properties.getKnowledge().getMaxMatches()).isEqualTo(2);
                    assertThat(properties.getQuery().isUseLlm()).isFalse();
                    assertThat(properties.getGemini().getModelName()).isEqualTo("gemini-2.0-flash");
                });
    }
}
