package com.eainde.salary.query;

import com.eainde.salary.model.Profile;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic query templates aimed at the usual salary data sites.
 * A profile with no distinguishing fields degrades to a generic query.
 */
public class TemplateQueryGenerator implements QueryGenerator {

    static final String GENERIC_QUERY = "average professional salary";

    private final int maxQueries;
    private final Clock clock;

    public TemplateQueryGenerator(int maxQueries, Clock clock) {
        if (maxQueries < 1) {
            throw new IllegalArgumentException("maxQueries must be at least 1");
        }
        this.maxQueries = maxQueries;
        this.clock = clock;
    }

    @Override
    public List<String> generate(Profile profile) {
        int year = Year.now(clock).getValue();
        String where = profile.hasLocation() ? " " + profile.location() : "";
        List<String> queries = new ArrayList<>();

        if (profile.hasTitle()) {
            queries.add(profile.title() + " salary" + where + " " + year);
            if (profile.hasCompany()) {
                queries.add(profile.company() + " " + profile.title() + " compensation levels.fyi");
                queries.add(profile.title() + " " + profile.company() + " salary " + year);
            }
            queries.add(profile.title() + " salary glassdoor" + where);
            queries.add(profile.title() + " total compensation" + where);
        } else if (profile.hasCompany()) {
            queries.add(profile.company() + " salary" + where + " " + year);
            queries.add(profile.company() + " compensation levels.fyi");
        }

        List<String> normalized = QueryNormalizer.normalize(queries, maxQueries);
        if (normalized.isEmpty()) {
            normalized = QueryNormalizer.normalize(List.of(GENERIC_QUERY + where + " " + year), maxQueries);
        }
        return List.copyOf(normalized);
    }
}
