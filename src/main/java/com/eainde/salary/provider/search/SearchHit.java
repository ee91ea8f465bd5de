package com.eainde.salary.provider.search;

import java.util.List;

/**
 * One parsed search result with the salary figures found in it.
 */
record SearchHit(String query, String domain, String title, String snippet,
                 List<SalaryMention> mentions, double relevance) {
}
