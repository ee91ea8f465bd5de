package com.eainde.salary.aggregation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Every tunable constant used by {@link SalaryAggregator}.
 *
 * <p>Defaults are the documented production values. Tests and the Spring
 * configuration layer override them through {@link #toBuilder()}.</p>
 */
@Value
@Builder(toBuilder = true)
public class AggregationSettings {

    /** First match wins, so remote sits ahead of the metro tiers. */
    public static final List<LocationTier> DEFAULT_LOCATION_TIERS = List.of(
            new LocationTier("remote", -0.15, List.of("remote")),
            new LocationTier("SF Bay Area", 0.15, List.of(
                    "san francisco", "bay area", "sf", "palo alto", "mountain view", "menlo park",
                    "sunnyvale", "san jose", "cupertino", "redwood city", "oakland", "santa clara")),
            new LocationTier("New York City", 0.12, List.of(
                    "new york", "nyc", "manhattan", "brooklyn")),
            new LocationTier("Seattle Area", 0.08, List.of(
                    "seattle", "bellevue", "redmond", "kirkland")),
            new LocationTier("Boston Area", 0.05, List.of("boston", "cambridge, ma")),
            new LocationTier("Los Angeles Area", 0.05, List.of("los angeles", "santa monica")),
            new LocationTier("Austin", -0.10, List.of("austin")));

    public static final List<CompanyTier> DEFAULT_COMPANY_TIERS = List.of(
            new CompanyTier("faang", "FAANG-tier", 0.20, List.of(
                    "google", "alphabet", "meta", "facebook", "apple", "amazon", "netflix", "microsoft")),
            new CompanyTier("tier1", "top-tier tech", 0.10, List.of(
                    "stripe", "airbnb", "uber", "openai", "databricks", "linkedin", "nvidia",
                    "snowflake", "coinbase")));

    public static final List<ExperienceBand> DEFAULT_EXPERIENCE_BANDS = List.of(
            new ExperienceBand("junior", 0, 2.0, -0.10),
            new ExperienceBand("mid", 2, 5.0, 0.0),
            new ExperienceBand("senior", 5, 8.0, 0.05),
            new ExperienceBand("staff", 8, 12.0, 0.10),
            new ExperienceBand("principal", 12, null, 0.15));

    @Builder.Default String defaultCurrency = "USD";
    @Builder.Default long sanityCeiling = 5_000_000L;

    @Builder.Default double dedupTolerance = 0.02;

    @Builder.Default int minSampleForOutliers = 3;
    @Builder.Default double outlierMadMultiplier = 3.0;
    @Builder.Default double madNormalConstant = 1.4826;
    @Builder.Default double outlierMinRelativeDeviation = 0.10;

    @Builder.Default double knowledgeStoreWeight = 0.9;
    @Builder.Default double webSearchWeight = 0.6;
    @Builder.Default double minimumWeight = 0.05;

    @Builder.Default double lowPercentile = 0.10;
    @Builder.Default double highPercentile = 0.90;

    @Builder.Default double countWeight = 0.4;
    @Builder.Default double diversityWeight = 0.3;
    @Builder.Default double spreadWeight = 0.3;
    @Builder.Default double countScale = 3.0;
    @Builder.Default int diversityTarget = 4;
    @Builder.Default double spreadCeiling = 2.0;

    @Builder.Default List<LocationTier> locationTiers = DEFAULT_LOCATION_TIERS;
    @Builder.Default List<CompanyTier> companyTiers = DEFAULT_COMPANY_TIERS;
    @Builder.Default List<ExperienceBand> experienceBands = DEFAULT_EXPERIENCE_BANDS;

    public static AggregationSettings defaults() {
        return AggregationSettings.builder().build();
    }
}
