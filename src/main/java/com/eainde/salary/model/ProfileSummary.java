package com.eainde.salary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

/**
 * Profile fields echoed back in the result. Unknown fields serialize as null.
 */
@JsonPropertyOrder({"title", "company", "years_of_experience", "location"})
public record ProfileSummary(
        @JsonProperty("title")               String title,
        @JsonProperty("company")             String company,
        @JsonProperty("years_of_experience") Double yearsOfExperience,
        @JsonProperty("location")            String location
) implements Serializable {

    public static ProfileSummary from(Profile profile) {
        return new ProfileSummary(profile.title(), profile.company(),
                profile.yearsOfExperience(), profile.location());
    }
}
