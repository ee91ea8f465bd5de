package com.eainde.salary.provider.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One curated salary benchmark from the knowledge store.
 *
 * @param role                 job role the benchmark describes
 * @param location             city / region, or "Remote"
 * @param companyTier          tier code ({@code faang}, {@code tier1}, {@code tier2}, {@code startup}, {@code unknown})
 * @param yearsOfExperienceMin lower bound of the experience window
 * @param yearsOfExperienceMax upper bound of the experience window
 * @param salaryMin            low end of the range
 * @param salaryMax            high end of the range
 * @param salaryMedian         median of the range
 * @param currency             ISO currency code
 * @param source               provenance tag
 * @param year                 data year
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalaryBenchmark(
        @JsonProperty("role")                    String role,
        @JsonProperty("location")                String location,
        @JsonProperty("company_tier")            String companyTier,
        @JsonProperty("years_of_experience_min") int yearsOfExperienceMin,
        @JsonProperty("years_of_experience_max") int yearsOfExperienceMax,
        @JsonProperty("salary_min")              long salaryMin,
        @JsonProperty("salary_max")              long salaryMax,
        @JsonProperty("salary_median")           long salaryMedian,
        @JsonProperty("currency")                String currency,
        @JsonProperty("source")                  String source,
        @JsonProperty("year")                    int year
) {

    public SalaryBenchmark {
        companyTier = companyTier == null ? "unknown" : companyTier;
        currency = currency == null ? "USD" : currency;
        source = source == null ? "internal_kb" : source;
    }
}
