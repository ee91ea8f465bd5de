package com.eainde.salary.aggregation;

import com.eainde.salary.model.Estimate;
import com.eainde.salary.model.Profile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies profile-driven multipliers in a fixed order: location tier,
 * company tier, experience band. Neutral or inapplicable adjustments leave no
 * trace in the returned descriptions.
 */
final class ProfileAdjuster {

    /**
     * @param estimate     the adjusted estimate
     * @param descriptions one line per applied adjustment, in application order
     */
    record Result(Estimate estimate, List<String> descriptions) {
    }

    private final AggregationSettings settings;

    ProfileAdjuster(AggregationSettings settings) {
        this.settings = settings;
    }

    Result apply(Estimate base, Profile profile) {
        Estimate estimate = base;
        List<String> descriptions = new ArrayList<>();

        if (profile.hasLocation()) {
            for (LocationTier tier : settings.getLocationTiers()) {
                if (tier.matches(profile.location())) {
                    if (tier.adjustment() != 0.0) {
                        estimate = estimate.scale(1.0 + tier.adjustment());
                        descriptions.add(percent(tier.adjustment()) + " for " + tier.label() + " location");
                    }
                    break;
                }
            }
        }

        if (profile.hasCompany()) {
            for (CompanyTier tier : settings.getCompanyTiers()) {
                if (tier.matches(profile.company())) {
                    if (tier.adjustment() != 0.0) {
                        estimate = estimate.scale(1.0 + tier.adjustment());
                        descriptions.add(percent(tier.adjustment()) + " for " + tier.label()
                                + " employer (" + profile.company() + ")");
                    }
                    break;
                }
            }
        }

        if (profile.hasYearsOfExperience()) {
            double years = profile.yearsOfExperience();
            for (ExperienceBand band : settings.getExperienceBands()) {
                if (band.contains(years)) {
                    if (band.adjustment() != 0.0) {
                        estimate = estimate.scale(1.0 + band.adjustment());
                        descriptions.add(percent(band.adjustment()) + " for " + band.label()
                                + "-level experience (" + years(years) + " years)");
                    }
                    break;
                }
            }
        }

        return new Result(estimate, List.copyOf(descriptions));
    }

    static String percent(double fraction) {
        BigDecimal pct = BigDecimal.valueOf(fraction * 100).setScale(1, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        String sign = fraction > 0 ? "+" : "";
        return sign + pct.toPlainString() + "%";
    }

    private static String years(double years) {
        if (years == Math.rint(years)) {
            return String.format(Locale.ROOT, "%.0f", years);
        }
        return String.format(Locale.ROOT, "%.1f", years);
    }
}
