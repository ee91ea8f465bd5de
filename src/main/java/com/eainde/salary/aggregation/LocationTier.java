package com.eainde.salary.aggregation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Named metro area with a multiplicative pay adjustment.
 *
 * @param label      display name used in the adjustment text
 * @param adjustment fractional change, e.g. {@code 0.15} for +15%
 * @param keywords   location fragments matched case-insensitively on word boundaries
 */
public record LocationTier(String label, double adjustment, List<String> keywords) {

    public LocationTier {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean matches(String location) {
        if (location == null) {
            return false;
        }
        String haystack = location.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b");
            if (pattern.matcher(haystack).find()) {
                return true;
            }
        }
        return false;
    }
}
