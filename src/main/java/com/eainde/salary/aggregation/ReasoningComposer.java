package com.eainde.salary.aggregation;

import com.eainde.salary.model.Estimate;

import java.util.List;
import java.util.Locale;

/**
 * Builds the reasoning text by template substitution only.
 */
final class ReasoningComposer {

    static final String NO_DATA = "No salary data was found for this profile; no estimate could be produced.";

    String compose(int dataPoints, List<String> sources, Estimate unadjusted,
                   List<String> adjustments, Estimate adjusted) {
        StringBuilder sb = new StringBuilder();
        sb.append("Estimate based on ").append(dataPoints).append(" data point(s) from ")
                .append(sources.size()).append(" source(s): ")
                .append(String.join(", ", sources)).append(". ");
        sb.append("Weighted median before adjustments: ")
                .append(unadjusted.currency()).append(' ').append(amount(unadjusted.median())).append(". ");
        if (adjustments.isEmpty()) {
            sb.append("No profile-based adjustments applied. ");
        } else {
            sb.append("Adjustments applied: ").append(String.join("; ", adjustments)).append(". ");
        }
        sb.append("Final range: ").append(adjusted.currency()).append(' ')
                .append(amount(adjusted.min())).append(" - ").append(amount(adjusted.max()))
                .append(" (median ").append(amount(adjusted.median())).append(").");
        return sb.toString();
    }

    String composeEmpty(int collected) {
        if (collected == 0) {
            return NO_DATA;
        }
        return NO_DATA + " " + collected + " observation(s) were collected but none survived filtering.";
    }

    static String amount(long value) {
        return String.format(Locale.US, "%,d", value);
    }
}
