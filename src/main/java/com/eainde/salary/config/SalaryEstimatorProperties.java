package com.eainde.salary.config;

import com.eainde.salary.aggregation.AggregationSettings;
import com.eainde.salary.aggregation.CompanyTier;
import com.eainde.salary.aggregation.ExperienceBand;
import com.eainde.salary.aggregation.LocationTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything under the {@code salary} prefix in {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "salary")
public class SalaryEstimatorProperties {

    @NestedConfigurationProperty
    private Gemini gemini = new Gemini();

    @NestedConfigurationProperty
    private Query query = new Query();

    @NestedConfigurationProperty
    private Search search = new Search();

    @NestedConfigurationProperty
    private Knowledge knowledge = new Knowledge();

    @NestedConfigurationProperty
    private Pipeline pipeline = new Pipeline();

    @NestedConfigurationProperty
    private Aggregation aggregation = new Aggregation();

    @NestedConfigurationProperty
    private Adjustments adjustments = new Adjustments();

    @Data
    public static class Gemini {
        private String apiKey;
        private String modelName = "gemini-2.0-flash";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private double temperature = 0.0;
    }

    @Data
    public static class Query {
        private int maxQueries = 5;
        /** When false, only the deterministic templates are used. */
        private boolean useLlm = true;
    }

    @Data
    public static class Search {
        private boolean enabled = true;
        private String apiKey;
        private String engineId;
        private String endpoint = "https://www.googleapis.com/customsearch/v1";
        private int resultsPerQuery = 5;
        private Duration timeout = Duration.ofSeconds(5);
        private int maxAttempts = 2;
        private Duration retryBackoff = Duration.ofMillis(250);
        private int maxResults = 15;
    }

    @Data
    public static class Knowledge {
        private String seedResource = "data/salary_benchmarks.json";
        private int maxMatches = 5;
        private int experienceSlack = 2;
    }

    @Data
    public static class Pipeline {
        private Duration branchTimeout = Duration.ofSeconds(10);
    }

    /**
     * Mirrors {@link AggregationSettings}; defaults are taken from there so the
     * two never drift apart.
     */
    @Data
    public static class Aggregation {
        private static final AggregationSettings DEFAULTS = AggregationSettings.defaults();

        private String defaultCurrency = DEFAULTS.getDefaultCurrency();
        private long sanityCeiling = DEFAULTS.getSanityCeiling();
        private double dedupTolerance = DEFAULTS.getDedupTolerance();
        private int minSampleForOutliers = DEFAULTS.getMinSampleForOutliers();
        private double outlierMadMultiplier = DEFAULTS.getOutlierMadMultiplier();
        private double madNormalConstant = DEFAULTS.getMadNormalConstant();
        private double outlierMinRelativeDeviation = DEFAULTS.getOutlierMinRelativeDeviation();
        private double knowledgeStoreWeight = DEFAULTS.getKnowledgeStoreWeight();
        private double webSearchWeight = DEFAULTS.getWebSearchWeight();
        private double minimumWeight = DEFAULTS.getMinimumWeight();
        private double lowPercentile = DEFAULTS.getLowPercentile();
        private double highPercentile = DEFAULTS.getHighPercentile();
        private double countWeight = DEFAULTS.getCountWeight();
        private double diversityWeight = DEFAULTS.getDiversityWeight();
        private double spreadWeight = DEFAULTS.getSpreadWeight();
        private double countScale = DEFAULTS.getCountScale();
        private int diversityTarget = DEFAULTS.getDiversityTarget();
        private double spreadCeiling = DEFAULTS.getSpreadCeiling();

        public AggregationSettings toSettings(Adjustments adjustments) {
            return AggregationSettings.builder()
                    .defaultCurrency(defaultCurrency)
                    .sanityCeiling(sanityCeiling)
                    .dedupTolerance(dedupTolerance)
                    .minSampleForOutliers(minSampleForOutliers)
                    .outlierMadMultiplier(outlierMadMultiplier)
                    .madNormalConstant(madNormalConstant)
                    .outlierMinRelativeDeviation(outlierMinRelativeDeviation)
                    .knowledgeStoreWeight(knowledgeStoreWeight)
                    .webSearchWeight(webSearchWeight)
                    .minimumWeight(minimumWeight)
                    .lowPercentile(lowPercentile)
                    .highPercentile(highPercentile)
                    .countWeight(countWeight)
                    .diversityWeight(diversityWeight)
                    .spreadWeight(spreadWeight)
                    .countScale(countScale)
                    .diversityTarget(diversityTarget)
                    .spreadCeiling(spreadCeiling)
                    .locationTiers(adjustments.effectiveLocations())
                    .companyTiers(adjustments.effectiveCompanies())
                    .experienceBands(adjustments.effectiveExperience())
                    .build();
        }
    }

    /**
     * Adjustment tables. An empty list keeps the built-in table.
     */
    @Data
    public static class Adjustments {
        private List<LocationTier> locations = new ArrayList<>();
        private List<CompanyTier> companies = new ArrayList<>();
        private List<ExperienceBand> experience = new ArrayList<>();

        public List<LocationTier> effectiveLocations() {
            return locations.isEmpty() ? AggregationSettings.DEFAULT_LOCATION_TIERS : List.copyOf(locations);
        }

        public List<CompanyTier> effectiveCompanies() {
            return companies.isEmpty() ? AggregationSettings.DEFAULT_COMPANY_TIERS : List.copyOf(companies);
        }

        public List<ExperienceBand> effectiveExperience() {
            return experience.isEmpty() ? AggregationSettings.DEFAULT_EXPERIENCE_BANDS : List.copyOf(experience);
        }
    }
}
