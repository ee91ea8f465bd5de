package com.eainde.salary.query;

import dev.langchain4j.model.output.structured.Description;

import java.util.List;

/**
 * Structured answer of {@link SearchQueryAgent}.
 */
public record SearchQueries(
        @Description("Between 3 and 5 Google search queries that find salary data for the profile")
        List<String> queries
) {
}
