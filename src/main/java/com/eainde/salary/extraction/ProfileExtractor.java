package com.eainde.salary.extraction;

import com.eainde.salary.model.Profile;

/**
 * Turns free profile text into structured {@link Profile} facts.
 *
 * <p>Implementations return partial profiles with unknown fields set to null.
 * They throw {@link ProfileExtractionException} only when nothing usable could
 * be extracted at all.</p>
 */
public interface ProfileExtractor {

    Profile extract(String profileText);
}
