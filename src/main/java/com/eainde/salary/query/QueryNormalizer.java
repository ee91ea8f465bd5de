package com.eainde.salary.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Trims, collapses whitespace, removes case-insensitive duplicates and caps the list.
 */
final class QueryNormalizer {

    private QueryNormalizer() {
    }

    static List<String> normalize(List<String> queries, int maxQueries) {
        List<String> result = new ArrayList<>();
        if (queries == null) {
            return result;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String query : queries) {
            if (query == null) {
                continue;
            }
            String cleaned = query.trim().replaceAll("\\s+", " ");
            if (cleaned.isEmpty() || !seen.add(cleaned.toLowerCase(Locale.ROOT))) {
                continue;
            }
            result.add(cleaned);
            if (result.size() >= maxQueries) {
                break;
            }
        }
        return result;
    }
}
