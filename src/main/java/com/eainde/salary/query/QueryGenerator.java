package com.eainde.salary.query;

import com.eainde.salary.model.Profile;

import java.util.List;

/**
 * Produces the ordered web search queries for a profile. Never returns an empty list.
 */
public interface QueryGenerator {

    List<String> generate(Profile profile);
}
