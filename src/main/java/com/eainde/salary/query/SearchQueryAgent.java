package com.eainde.salary.query;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LLM-backed search query writer.
 */
public interface SearchQueryAgent {

    @SystemMessage("""
            You are an expert at crafting Google search queries that find accurate salary information.
            Given a professional profile, generate 3-5 targeted search queries.

            Guidelines:
            1. Include the job title, the location and the current year
            2. Target known salary data sources: levels.fyi, glassdoor, linkedin salary, indeed, payscale
            3. Include variations: exact title, similar titles, company-specific for well-known employers
            4. Reflect the experience level ("senior", "staff", ...) where it fits
            5. For remote roles also search for the base location when known
            """)
    @UserMessage("""
            Generate search queries for this profile:

            Title: {{title}}
            Company: {{company}}
            Location: {{location}}
            Years of Experience: {{yearsOfExperience}}
            Skills: {{skills}}
            Industry: {{industry}}
            Current year: {{year}}
            """)
    SearchQueries generate(@V("title") String title,
                           @V("company") String company,
                           @V("location") String location,
                           @V("yearsOfExperience") String yearsOfExperience,
                           @V("skills") String skills,
                           @V("industry") String industry,
                           @V("year") int year);
}
