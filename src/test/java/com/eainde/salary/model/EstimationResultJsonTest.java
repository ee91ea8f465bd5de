package com.eainde.salary.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EstimationResultJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should serialise with the external snake_case field names")
    void fieldNames() throws Exception {
        EstimationResult result = new EstimationResult(
                new ProfileSummary("Staff Software Engineer", "Meta", 9.0, "San Francisco, CA"),
                Estimate.of("USD", 303_600, 516_120, 759_000),
                Confidence.of(0.75, 7, List.of("+15% for SF Bay Area location")),
                "reasoning",
                List.of("internal_kb", "levels.fyi"),
                List.of("+15% for SF Bay Area location"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertThat(json.fieldNames()).toIterable().containsExactly(
                "profile_summary", "salary_estimate", "confidence", "reasoning", "sources", "adjustments");
        assertThat(json.path("profile_summary").fieldNames()).toIterable()
                .containsExactly("title", "company", "years_of_experience", "location");
        assertThat(json.path("salary_estimate").fieldNames()).toIterable()
                .containsExactly("currency", "min", "max", "median");
        assertThat(json.path("confidence").fieldNames()).toIterable()
                .containsExactly("score", "level", "data_points", "factors");
        assertThat(json.path("confidence").path("level").asText()).isEqualTo("high");
        assertThat(json.path("confidence").path("data_points").asInt()).isEqualTo(7);
        assertThat(json.path("salary_estimate").path("median").asLong()).isEqualTo(516_120L);
    }

    @Test
    @DisplayName("should write nulls for an empty estimate and unknown profile fields")
    void nulls() throws Exception {
        EstimationResult result = new EstimationResult(
                new ProfileSummary("Engineer", null, null, null),
                Estimate.unset("USD"),
                Confidence.none(List.of()),
                "No data",
                List.of(),
                List.of());

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertThat(json.path("salary_estimate").path("min").isNull()).isTrue();
        assertThat(json.path("salary_estimate").path("median").isNull()).isTrue();
        assertThat(json.path("profile_summary").path("company").isNull()).isTrue();
        assertThat(json.path("confidence").path("level").asText()).isEqualTo("low");
    }

    @Test
    @DisplayName("should refuse adjustments that are not confidence factors")
    void adjustmentsSubsetOfFactors() {
        assertThatThrownBy(() -> new EstimationResult(
                new ProfileSummary("Engineer", null, null, null),
                Estimate.of("USD", 1, 2, 3),
                Confidence.of(0.5, 1, List.of()),
                "r",
                List.of("a"),
                List.of("+10% for something")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
