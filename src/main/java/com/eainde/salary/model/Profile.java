package com.eainde.salary.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structured facts about the person being estimated.
 *
 * <p>Unknown fields are {@code null}; they are never represented as an empty
 * string or zero, so adjustments can tell "unknown" apart from a real value.</p>
 *
 * @param title             current job title, or null
 * @param company           current employer, or null
 * @param yearsOfExperience total professional experience, non-negative, or null
 * @param location          work location as free text, or null
 * @param skills            key skills in extraction order
 * @param industry          industry sector, or null
 * @param education         highest degree, or null
 */
public record Profile(
        String title,
        String company,
        Double yearsOfExperience,
        String location,
        Set<String> skills,
        String industry,
        String education
) implements Serializable {

    public Profile {
        title = normalize(title);
        company = normalize(company);
        location = normalize(location);
        industry = normalize(industry);
        education = normalize(education);
        if (yearsOfExperience != null && (yearsOfExperience.isNaN() || yearsOfExperience < 0)) {
            yearsOfExperience = null;
        }
        Set<String> cleaned = new LinkedHashSet<>();
        if (skills != null) {
            for (String skill : skills) {
                String s = normalize(skill);
                if (s != null) {
                    cleaned.add(s);
                }
            }
        }
        skills = Collections.unmodifiableSet(cleaned);
    }

    public static Profile of(String title, String company, Double yearsOfExperience, String location) {
        return new Profile(title, company, yearsOfExperience, location, Set.of(), null, null);
    }

    public boolean hasTitle()             { return title != null; }
    public boolean hasCompany()           { return company != null; }
    public boolean hasYearsOfExperience() { return yearsOfExperience != null; }
    public boolean hasLocation()          { return location != null; }

    /**
     * True when at least one of title, company or experience is known.
     * A profile without any of them gives the pipeline nothing to look up.
     */
    public boolean hasUsableIdentity() {
        return hasTitle() || hasCompany() || hasYearsOfExperience();
    }

    /**
     * One-line description used as search context, skipping unknown parts.
     */
    public String toSearchContext() {
        List<String> parts = new ArrayList<>();
        parts.add(hasTitle() ? title : "Professional");
        if (hasCompany()) {
            parts.add("at " + company);
        }
        if (hasLocation()) {
            parts.add("in " + location);
        }
        if (hasYearsOfExperience() && yearsOfExperience > 0) {
            parts.add(String.format(Locale.ROOT, "with %.0f years experience", yearsOfExperience));
        }
        return String.join(" ", parts);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || "unknown".equalsIgnoreCase(trimmed)
                || "n/a".equalsIgnoreCase(trimmed) || "null".equalsIgnoreCase(trimmed)) {
            return null;
        }
        return trimmed;
    }
}
