package com.eainde.salary.provider.search;

/**
 * A salary figure found in search text; a single figure has {@code low == high}.
 */
public record SalaryMention(long low, long high) {
}
