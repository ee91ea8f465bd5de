package com.eainde.salary.extraction;

import com.eainde.salary.model.Profile;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;

/**
 * {@link ProfileExtractor} backed by a Gemini {@link ProfileExtractionAgent}.
 */
@Slf4j
public class GeminiProfileExtractor implements ProfileExtractor {

    private final ProfileExtractionAgent agent;

    public GeminiProfileExtractor(ProfileExtractionAgent agent) {
        this.agent = agent;
    }

    @Override
    public Profile extract(String profileText) {
        if (profileText == null || profileText.isBlank()) {
            throw new ProfileExtractionException("No profile text provided");
        }

        ExtractedProfile extracted;
        try {
            extracted = agent.extract(profileText);
        } catch (RuntimeException e) {
            throw new ProfileExtractionException("Profile extraction failed: " + e.getMessage(), e);
        }
        if (extracted == null) {
            throw new ProfileExtractionException("Profile extraction returned no result");
        }

        Profile profile = new Profile(
                extracted.title(),
                extracted.company(),
                extracted.yearsOfExperience(),
                extracted.location(),
                extracted.skills() == null ? null : new LinkedHashSet<>(extracted.skills()),
                extracted.industry(),
                extracted.education());

        if (!profile.hasUsableIdentity()) {
            throw new ProfileExtractionException(
                    "Could not determine a title, company or years of experience from the profile");
        }
        log.info("Extracted profile: {}", profile.toSearchContext());
        return profile;
    }
}
