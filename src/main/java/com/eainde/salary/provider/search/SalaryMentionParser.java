package com.eainde.salary.provider.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls annual salary figures out of search titles and snippets.
 *
 * <p>Recognizes ranges ({@code $180,000 - $250,000}, {@code $180k-$250k},
 * {@code 180k to 250k}) and single figures ({@code $180,000}, {@code $180k},
 * {@code 180K}). A bare number without a dollar sign or a {@code k} suffix is
 * ignored so years and counts are not mistaken for pay.</p>
 */
public class SalaryMentionParser {

    public static final long MIN_PLAUSIBLE = 30_000L;
    public static final long MAX_PLAUSIBLE = 2_000_000L;

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?)";

    private static final Pattern RANGE = Pattern.compile(
            "(\\$)?\\s?" + NUMBER + "\\s*([kK])?\\s*(?:-|–|—|to)\\s*(\\$)?\\s?" + NUMBER + "\\s*([kK])?\\b");

    private static final Pattern SINGLE = Pattern.compile(
            "(\\$)\\s?" + NUMBER + "\\s*([kK])?\\b|\\b" + NUMBER + "\\s*([kK])\\b");

    public List<SalaryMention> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<SalaryMention> mentions = new LinkedHashSet<>();
        StringBuilder remaining = new StringBuilder(text);

        Matcher range = RANGE.matcher(text);
        while (range.find()) {
            boolean dollar = range.group(1) != null || range.group(4) != null;
            boolean lowK = range.group(3) != null;
            boolean highK = range.group(6) != null;
            if (!dollar && !lowK && !highK) {
                continue;
            }
            double lowValue = number(range.group(2));
            double highValue = number(range.group(5));
            long low = Math.round(lowK || (highK && lowValue < 1000) ? lowValue * 1000 : lowValue);
            long high = Math.round(highK ? highValue * 1000 : highValue);
            if (plausible(low) && plausible(high) && low <= high) {
                mentions.add(new SalaryMention(low, high));
                blank(remaining, range.start(), range.end());
            }
        }

        Matcher single = SINGLE.matcher(remaining);
        while (single.find()) {
            String digits = single.group(2) != null ? single.group(2) : single.group(4);
            boolean thousands = single.group(3) != null || single.group(5) != null;
            double value = number(digits);
            long amount = Math.round(thousands ? value * 1000 : value);
            if (plausible(amount)) {
                mentions.add(new SalaryMention(amount, amount));
            }
        }
        return new ArrayList<>(mentions);
    }

    private static boolean plausible(long amount) {
        return amount >= MIN_PLAUSIBLE && amount <= MAX_PLAUSIBLE;
    }

    private static double number(String digits) {
        return Double.parseDouble(digits.replace(",", "").toLowerCase(Locale.ROOT));
    }

    private static void blank(StringBuilder text, int start, int end) {
        for (int i = start; i < end; i++) {
            text.setCharAt(i, ' ');
        }
    }
}
