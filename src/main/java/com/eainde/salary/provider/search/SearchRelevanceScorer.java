package com.eainde.salary.provider.search;

import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic relevance of a search hit to a salary question, in [0,1].
 * Used as the observation weight hint.
 */
public class SearchRelevanceScorer {

    static final List<String> TRUSTED_DOMAINS =
            List.of("levels.fyi", "glassdoor", "indeed", "payscale", "linkedin", "builtin", "salary.com");
    static final List<String> SALARY_KEYWORDS =
            List.of("salary", "compensation", "pay", "wage", "earning", "total comp");

    private static final Pattern DOLLAR_FIGURE = Pattern.compile("\\$[\\d,]+");

    private final Clock clock;

    public SearchRelevanceScorer(Clock clock) {
        this.clock = clock;
    }

    public double score(String domain, String title, String snippet) {
        String lowerDomain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        String lowerSnippet = snippet == null ? "" : snippet.toLowerCase(Locale.ROOT);

        double score = 0.5;
        if (TRUSTED_DOMAINS.stream().anyMatch(lowerDomain::contains)) {
            score += 0.2;
        }
        if (SALARY_KEYWORDS.stream().anyMatch(k -> lowerTitle.contains(k) || lowerSnippet.contains(k))) {
            score += 0.15;
        }
        int year = Year.now(clock).getValue();
        if (lowerSnippet.contains(String.valueOf(year)) || lowerSnippet.contains(String.valueOf(year - 1))) {
            score += 0.1;
        }
        if (DOLLAR_FIGURE.matcher(lowerSnippet).find()) {
            score += 0.05;
        }
        return Math.min(score, 1.0);
    }
}
