package com.eainde.salary.extraction;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LLM-backed extraction of profile facts from LinkedIn-style text.
 */
public interface ProfileExtractionAgent {

    @SystemMessage("""
            You are an expert at extracting structured information from LinkedIn profiles.
            Given a profile as free text or semi-structured data, extract:

            1. title: the current job title
            2. company: the current employer
            3. yearsOfExperience: total years of professional experience; sum the durations
               of all listed positions when it is not stated directly
            4. location: work location (city, state/country); note "Remote" when remote
            5. skills: up to 10 of the most relevant skills
            6. industry: industry sector
            7. education: highest education level or notable degree

            Extract only what is stated or can be reasonably inferred.
            Never invent values: use "unknown" for missing text fields and null for a missing number.
            """)
    @UserMessage("""
            Extract structured information from this profile:

            {{profileText}}
            """)
    ExtractedProfile extract(@V("profileText") String profileText);
}
