package com.eainde.salary.provider;

import com.eainde.salary.model.Observation;
import com.eainde.salary.model.Profile;

import java.util.List;

/**
 * Structured benchmark lookup keyed on profile facts rather than query text.
 */
public interface KnowledgeStoreObservationProvider {

    /**
     * @param profile extracted profile facts
     * @return matching benchmark observations; empty when nothing matches
     * @throws ObservationProviderException when the store cannot be reached
     */
    List<Observation> lookup(Profile profile);
}
