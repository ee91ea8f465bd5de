package com.eainde.salary.extraction;

import dev.langchain4j.model.output.structured.Description;

import java.util.List;

/**
 * Structured answer of {@link ProfileExtractionAgent}. Field descriptions are
 * sent to the model as part of the JSON schema.
 */
public record ExtractedProfile(
        @Description("Current job title, e.g. 'Senior Software Engineer'. Use 'unknown' if not stated")
        String title,
        @Description("Current employer name. Use 'unknown' if not stated")
        String company,
        @Description("Total years of professional experience summed over all positions, or null if it cannot be inferred")
        Double yearsOfExperience,
        @Description("Work location as city and state/country, or 'Remote'. Use 'unknown' if not stated")
        String location,
        @Description("Up to 10 key technical or professional skills")
        List<String> skills,
        @Description("Industry sector, e.g. 'Technology', 'Finance'")
        String industry,
        @Description("Highest education level or notable degree")
        String education
) {
}
