package com.eainde.salary.provider;

import com.eainde.salary.model.Observation;

import java.util.List;

/**
 * Web-search flavoured observation source, driven by generated query strings.
 */
public interface SearchObservationProvider {

    /**
     * @param queries ordered search queries, never empty
     * @return observations found; empty when the searches found nothing
     * @throws ObservationProviderException on a transport failure, never for "no results"
     */
    List<Observation> search(List<String> queries);
}
