package com.eainde.salary.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON request body for {@code POST /salary-estimates}.
 */
public record EstimationRequest(@JsonProperty("profile_text") String profileText) {
}
