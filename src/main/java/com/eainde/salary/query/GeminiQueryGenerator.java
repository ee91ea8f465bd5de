package com.eainde.salary.query;

import com.eainde.salary.model.Profile;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Asks Gemini for search queries and falls back to {@link TemplateQueryGenerator}
 * whenever the model fails or answers with nothing usable.
 */
@Slf4j
public class GeminiQueryGenerator implements QueryGenerator {

    private static final String UNKNOWN = "unknown";

    private final SearchQueryAgent agent;
    private final QueryGenerator fallback;
    private final int maxQueries;
    private final Clock clock;

    public GeminiQueryGenerator(SearchQueryAgent agent, QueryGenerator fallback, int maxQueries, Clock clock) {
        this.agent = agent;
        this.fallback = fallback;
        this.maxQueries = maxQueries;
        this.clock = clock;
    }

    @Override
    public List<String> generate(Profile profile) {
        try {
            SearchQueries answer = agent.generate(
                    orUnknown(profile.title()),
                    orUnknown(profile.company()),
                    orUnknown(profile.location()),
                    profile.hasYearsOfExperience()
                            ? String.format(Locale.ROOT, "%.0f", profile.yearsOfExperience())
                            : UNKNOWN,
                    profile.skills().isEmpty()
                            ? "N/A"
                            : profile.skills().stream().limit(5).collect(Collectors.joining(", ")),
                    profile.industry() == null ? "Technology" : profile.industry(),
                    Year.now(clock).getValue());

            List<String> queries = QueryNormalizer.normalize(answer == null ? null : answer.queries(), maxQueries);
            if (!queries.isEmpty()) {
                return List.copyOf(queries);
            }
            log.warn("Query model returned no queries, using templates");
        } catch (RuntimeException e) {
            log.warn("Query model failed, using templates: {}", e.getMessage());
        }
        return fallback.generate(profile);
    }

    private static String orUnknown(String value) {
        return value == null ? UNKNOWN : value;
    }
}
