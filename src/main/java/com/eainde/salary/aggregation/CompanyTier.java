package com.eainde.salary.aggregation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Named employer list with a multiplicative pay adjustment.
 *
 * @param code       short tier code shared with benchmark data, e.g. {@code faang}
 * @param label      display name used in the adjustment text
 * @param adjustment fractional change, e.g. {@code 0.20} for +20%
 * @param companies  employer names matched case-insensitively on word boundaries
 */
public record CompanyTier(String code, String label, double adjustment, List<String> companies) {

    public CompanyTier {
        companies = companies == null ? List.of() : List.copyOf(companies);
    }

    public boolean matches(String company) {
        if (company == null) {
            return false;
        }
        String haystack = company.toLowerCase(Locale.ROOT);
        for (String name : companies) {
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(name.toLowerCase(Locale.ROOT)) + "\\b");
            if (pattern.matcher(haystack).find()) {
                return true;
            }
        }
        return false;
    }
}
